package com.delta.adsync.sync.media;

public class MediaCacheException extends RuntimeException {
    public MediaCacheException(String message) {
        super(message);
    }

    public MediaCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
