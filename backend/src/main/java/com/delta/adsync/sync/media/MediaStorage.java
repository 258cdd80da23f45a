package com.delta.adsync.sync.media;

/** Where cached media bytes end up. */
public interface MediaStorage {

    /**
     * Stores the bytes under the relative path and returns the URL they are served from.
     *
     * @throws MediaCacheException when the bytes could not be written
     */
    String store(String relativePath, byte[] bytes, String contentType);

    boolean exists(String relativePath);
}
