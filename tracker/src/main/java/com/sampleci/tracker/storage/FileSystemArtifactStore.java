package com.sampleci.tracker.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * {@link ArtifactStore} backed by a local (or mounted) directory.
 * Only files inside the base directory can be read.
 */
@Component
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private final String basePath;

    public FileSystemArtifactStore(@Value("${sampleci.artifacts.base-path}") String basePath) {
        this.basePath = basePath;
    }

    @Override
    public byte[] read(String basePath, String fileName) {
        Path base = Path.of(basePath).toAbsolutePath().normalize();
        Path path = base.resolve(fileName).normalize();
        if (!path.startsWith(base) || path.equals(base)) {
            log.warn("Result file {} is outside {}", fileName, base);
            throw new ArtifactNotFoundException(path);
        }
        if (!Files.isRegularFile(path)) {
            log.warn("Result file {} does not exist", path);
            throw new ArtifactNotFoundException(path);
        }
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            // deleted between the check and the read
            throw new ArtifactNotFoundException(path, e);
        } catch (IOException e) {
            log.warn("Result file {} could not be read: {}", path, e.getMessage());
            throw new ArtifactNotFoundException(path, e);
        }
    }

    @Override
    public String defaultBasePath() {
        return basePath;
    }
}
