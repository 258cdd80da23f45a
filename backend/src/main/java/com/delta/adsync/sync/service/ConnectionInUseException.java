package com.delta.adsync.sync.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ConnectionInUseException extends RuntimeException {
    public ConnectionInUseException(String message) {
        super(message);
    }
}
