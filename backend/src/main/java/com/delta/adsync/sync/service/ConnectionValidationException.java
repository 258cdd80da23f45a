package com.delta.adsync.sync.service;

/** The platform rejected a token, or the token lacks a scope the sync needs. */
public class ConnectionValidationException extends RuntimeException {
    public ConnectionValidationException(String message) {
        super(message);
    }

    public ConnectionValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
