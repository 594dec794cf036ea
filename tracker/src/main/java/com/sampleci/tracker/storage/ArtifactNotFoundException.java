package com.sampleci.tracker.storage;

import java.nio.file.Path;

/**
 * Thrown when an expected or actual result file is missing or cannot be read.
 */
public class ArtifactNotFoundException extends ArtifactException {

    public ArtifactNotFoundException(Path path) {
        super("Result file not found: " + path);
    }

    public ArtifactNotFoundException(Path path, Throwable cause) {
        super("Result file could not be read: " + path, cause);
    }
}
