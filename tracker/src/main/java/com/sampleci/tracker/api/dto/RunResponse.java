package com.sampleci.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sampleci.tracker.model.Run;
import com.sampleci.tracker.model.RunPlatform;
import com.sampleci.tracker.model.RunType;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 *
 * token is only present in the creation response; the worker needs it,
 * nobody polling the run does.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        UUID        id,
        RunPlatform platform,
        RunType     runType,
        String      repositoryUrl,
        String      branch,
        String      commitHash,
        int         prNumber,
        String      sourceLink,
        Instant     createdAt,
        boolean     finished,
        boolean     failed,
        String      token
) {
    public static RunResponse from(Run run, boolean finished, boolean failed) {
        return of(run, finished, failed, null);
    }

    /** Creation response: a new run has no events yet and carries its token. */
    public static RunResponse created(Run run) {
        return of(run, false, false, run.getToken());
    }

    private static RunResponse of(Run run, boolean finished, boolean failed, String token) {
        return new RunResponse(
                run.getId(),
                run.getPlatform(),
                run.getRunType(),
                run.getRepositoryUrl(),
                run.getBranch(),
                run.getCommitHash(),
                run.getPrNumber(),
                run.sourceLink(),
                run.getCreatedAt(),
                finished,
                failed,
                token
        );
    }
}
