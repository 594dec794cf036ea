package com.sampleci.tracker.service;

import java.util.UUID;

public class ComparisonNotFoundException extends RuntimeException {
    public ComparisonNotFoundException(UUID runId, long caseId, long outputId) {
        super("No output comparison for run " + runId + ", case " + caseId + ", output " + outputId);
    }
}
