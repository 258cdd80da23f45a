package com.delta.adsync.sync.token;

/**
 * Token encryption or decryption could not be performed. Callers decide whether to fall back to
 * plaintext storage; the vault never does so on its own.
 */
public class TokenEncryptionException extends RuntimeException {
    public TokenEncryptionException(String message) {
        super(message);
    }

    public TokenEncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
