package com.sampleci.tracker.storage;

/**
 * Base class for failures while loading a result artifact.
 *
 * Unchecked: the controller advice turns the subclasses into distinct
 * HTTP answers; nothing in between has a recovery strategy.
 */
public abstract class ArtifactException extends RuntimeException {

    protected ArtifactException(String message) {
        super(message);
    }

    protected ArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
