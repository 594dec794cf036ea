package com.sampleci.tracker.api;

import com.sampleci.tracker.api.dto.*;
import com.sampleci.tracker.diff.RenderMode;
import com.sampleci.tracker.model.Run;
import com.sampleci.tracker.model.Stage;
import com.sampleci.tracker.model.StageEvent;
import com.sampleci.tracker.progress.RunStateMachine;
import com.sampleci.tracker.service.CaseOutcome;
import com.sampleci.tracker.service.ResultAggregator;
import com.sampleci.tracker.service.RunResults;
import com.sampleci.tracker.service.RunService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for run tracking.
 *
 * POST /runs                                              — register a run
 * GET  /runs/{id}                                         — run details incl. finished/failed
 * POST /runs/{id}/events                                  — append a stage event
 * GET  /runs/{id}/events                                  — the event log
 * GET  /runs/{id}/progress                                — progress report
 * POST /runs/{id}/results                                 — record a case result
 * POST /runs/{id}/results/{caseId}/outputs                — record an output comparison
 * GET  /runs/{id}/results                                 — per-case outcomes
 * GET  /runs/{id}/results/{caseId}/outputs/{outputId}/diff?mode=view|download
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService       runService;
    private final ResultAggregator resultAggregator;

    public RunController(RunService runService, ResultAggregator resultAggregator) {
        this.runService       = runService;
        this.resultAggregator = resultAggregator;
    }

    /**
     * Register a new run. The response carries the token the worker uses.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"platform":"LINUX","runType":"COMMIT","repositoryUrl":"https://github.com/org/repo.git",
     *          "branch":"master","commitHash":"a1b2c3"}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> create(@RequestBody CreateRunRequest req) {
        if (req.platform() == null || isBlank(req.repositoryUrl())
                || isBlank(req.branch()) || isBlank(req.commitHash())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "platform, repositoryUrl, branch and commitHash are required");
        }
        Run run = runService.create(req.platform(), req.runType(), req.repositoryUrl(),
                req.branch(), req.commitHash(), req.prNumber());
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.created(run));
    }

    /** Run details. Returns 404 if the run ID is not found. */
    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        Run run = requireRun(id);
        List<StageEvent> events = runService.events(id);
        return RunResponse.from(run, RunStateMachine.isFinished(events), RunStateMachine.hasFailed(events));
    }

    // ------------------------------------------------------------------
    // Event log
    // ------------------------------------------------------------------

    /**
     * Append a stage event.
     *
     * HTTP 201 — event recorded
     * HTTP 400 — unknown stage
     * HTTP 404 — run not found
     * HTTP 409 — the run already completed or was canceled
     */
    @PostMapping("/{id}/events")
    public ResponseEntity<EventResponse> recordEvent(@PathVariable UUID id,
                                                     @RequestBody RecordEventRequest req) {
        Stage stage = Stage.fromValue(req.stage());
        StageEvent event = runService.recordEvent(id, stage, req.message());
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.from(event));
    }

    @GetMapping("/{id}/events")
    public List<EventResponse> getEvents(@PathVariable UUID id) {
        requireRun(id);
        return runService.events(id).stream()
                .map(EventResponse::from)
                .toList();
    }

    /**
     * Progress report. A run without events answers with
     * state=error, step=-1 and unset timestamps rather than an error status.
     */
    @GetMapping("/{id}/progress")
    public ProgressResponse getProgress(@PathVariable UUID id) {
        requireRun(id);
        return ProgressResponse.from(runService.progress(id));
    }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    @PostMapping("/{id}/results")
    public ResponseEntity<Void> recordCaseResult(@PathVariable UUID id,
                                                 @RequestBody RecordCaseResultRequest req) {
        runService.recordCaseResult(id, req.caseId(), req.runtimeMs(), req.exitCode(), req.expectedExitCode());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @PostMapping("/{id}/results/{caseId}/outputs")
    public ResponseEntity<Void> recordOutput(@PathVariable UUID id,
                                             @PathVariable long caseId,
                                             @RequestBody RecordOutputRequest req) {
        if (isBlank(req.expectedFileRef())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "expectedFileRef is required");
        }
        runService.recordOutputComparison(id, caseId, req.outputId(),
                req.expectedFileRef(), req.actualFileRef(), req.fileExtension());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping("/{id}/results")
    public RunResults getResults(@PathVariable UUID id) {
        requireRun(id);
        return resultAggregator.summarize(id);
    }

    @GetMapping("/{id}/results/{caseId}")
    public CaseOutcome getCaseResult(@PathVariable UUID id, @PathVariable long caseId) {
        requireRun(id);
        return resultAggregator.outcome(id, caseId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No result for case " + caseId + " in run " + id));
    }

    /**
     * HTML diff of one mismatching output.
     *
     * mode=view (default) returns an embeddable fragment; mode=download returns
     * a standalone document as an attachment.
     */
    @GetMapping("/{id}/results/{caseId}/outputs/{outputId}/diff")
    public ResponseEntity<String> getDiff(@PathVariable UUID id,
                                          @PathVariable long caseId,
                                          @PathVariable long outputId,
                                          @RequestParam(defaultValue = "view") String mode) {
        RenderMode renderMode = RenderMode.fromValue(mode);
        requireRun(id);
        String html = resultAggregator.diff(id, caseId, outputId, renderMode);

        ResponseEntity.BodyBuilder response = ResponseEntity.ok().contentType(MediaType.TEXT_HTML);
        if (renderMode == RenderMode.DOWNLOAD) {
            String fileName = "run-" + id + "-case-" + caseId + "-output-" + outputId + "-diff.html";
            response.header(HttpHeaders.CONTENT_DISPOSITION,
                    ContentDisposition.attachment().filename(fileName).build().toString());
        }
        return response.body(html);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Run requireRun(UUID id) {
        return runService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
