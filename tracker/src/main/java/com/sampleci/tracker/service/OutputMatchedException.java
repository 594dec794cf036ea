package com.sampleci.tracker.service;

public class OutputMatchedException extends RuntimeException {
    public OutputMatchedException(long caseId, long outputId) {
        super("Output " + outputId + " of case " + caseId
                + " matched the expected result; there is no diff");
    }
}
