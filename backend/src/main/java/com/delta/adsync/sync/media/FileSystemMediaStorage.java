package com.delta.adsync.sync.media;

import com.delta.adsync.config.AdSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Local-disk storage. Files are written to a temp name in the target directory and moved into
 * place, so a reader never sees a partial file.
 */
@Component
public class FileSystemMediaStorage implements MediaStorage {
    private static final Logger log = LoggerFactory.getLogger(FileSystemMediaStorage.class);

    private final Path root;
    private final String publicBaseUrl;

    public FileSystemMediaStorage(AdSyncProperties properties) {
        this.root = Path.of(properties.getMedia().getStorageRoot()).toAbsolutePath().normalize();
        this.publicBaseUrl = properties.getMedia().getPublicBaseUrl();
    }

    @Override
    public String store(String relativePath, byte[] bytes, String contentType) {
        Path target = resolve(relativePath);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new MediaCacheException("Unable to write " + relativePath, e);
        }
        log.debug("Stored {} bytes ({}) at {}", bytes.length, contentType, target);
        return publicBaseUrl + "/" + relativePath;
    }

    @Override
    public boolean exists(String relativePath) {
        return Files.isRegularFile(resolve(relativePath));
    }

    Path root() {
        return root;
    }

    private Path resolve(String relativePath) {
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root)) {
            throw new MediaCacheException("Path escapes storage root: " + relativePath);
        }
        return target;
    }

    private void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Unable to remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
