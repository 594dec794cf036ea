package com.sampleci.tracker.model;

/**
 * Operating system a run executes on.
 */
public enum RunPlatform {
    LINUX,
    WINDOWS
}
