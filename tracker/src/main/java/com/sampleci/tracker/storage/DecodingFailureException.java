package com.sampleci.tracker.storage;

/**
 * Thrown when a result file is neither valid UTF-8 nor valid Windows-1252.
 * That only happens for corrupted files.
 */
public class DecodingFailureException extends ArtifactException {

    public DecodingFailureException(String fileName, String reason) {
        super("Could not decode " + fileName + ": " + reason);
    }
}
