package com.sampleci.tracker.api.dto;

/**
 * Request body for POST /runs/{id}/results/{caseId}/outputs.
 *
 * Leave actualFileRef null when the produced output was identical to the
 * expected file.
 */
public record RecordOutputRequest(long outputId, String expectedFileRef,
                                  String actualFileRef, String fileExtension) {}
