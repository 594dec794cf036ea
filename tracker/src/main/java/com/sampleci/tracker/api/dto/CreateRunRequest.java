package com.sampleci.tracker.api.dto;

import com.sampleci.tracker.model.RunPlatform;
import com.sampleci.tracker.model.RunType;

/**
 * Request body for POST /runs.
 *
 * Required: platform, repositoryUrl, branch, commitHash
 * Optional: runType (defaults to COMMIT), prNumber (defaults to 0)
 */
public record CreateRunRequest(RunPlatform platform, RunType runType, String repositoryUrl,
                               String branch, String commitHash, Integer prNumber) {

    public CreateRunRequest {
        if (runType == null) runType = RunType.COMMIT;
        if (prNumber == null) prNumber = 0;
    }
}
