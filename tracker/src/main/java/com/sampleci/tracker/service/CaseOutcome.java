package com.sampleci.tracker.service;

import java.util.List;

/**
 * Reported outcome of one case in a run.
 *
 * differingOutputIds lists the outputs that did not match and can be diffed.
 */
public record CaseOutcome(
        long       caseId,
        long       runtimeMs,
        int        exitCode,
        int        expectedExitCode,
        boolean    exitCodeMatches,
        List<Long> differingOutputIds,
        boolean    passed
) {}
