package com.delta.adsync.sync.service;

/** An account has no connection that can currently be used to read from the platform. */
public class ConnectionUnavailableException extends RuntimeException {
    public ConnectionUnavailableException(String message) {
        super(message);
    }

    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
