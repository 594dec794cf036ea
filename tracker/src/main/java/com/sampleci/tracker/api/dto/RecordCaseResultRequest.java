package com.sampleci.tracker.api.dto;

/** Request body for POST /runs/{id}/results. */
public record RecordCaseResultRequest(long caseId, long runtimeMs, int exitCode, int expectedExitCode) {}
