package com.sampleci.tracker.service;

import java.util.List;

public record RunResults(List<CaseOutcome> cases, int passed, int failed) {

    public static RunResults of(List<CaseOutcome> cases) {
        int passed = (int) cases.stream().filter(CaseOutcome::passed).count();
        return new RunResults(cases, passed, cases.size() - passed);
    }
}
