package com.sampleci.tracker.model;

/**
 * What triggered a run: a pushed commit or a pull request.
 */
public enum RunType {
    COMMIT,
    PULL_REQUEST
}
