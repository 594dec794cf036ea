package com.sampleci.tracker.storage;

/**
 * Read access to stored result files.
 */
public interface ArtifactStore {

    /**
     * Read the full content of {@code fileName} below {@code basePath}.
     *
     * @throws ArtifactNotFoundException if the file is absent or unreadable
     */
    byte[] read(String basePath, String fileName);

    /** Directory configured for result files. */
    String defaultBasePath();
}
