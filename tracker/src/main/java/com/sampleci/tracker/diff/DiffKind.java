package com.sampleci.tracker.diff;

public enum DiffKind {
    EQUAL,
    ADDED,
    REMOVED,
    CHANGED
}
