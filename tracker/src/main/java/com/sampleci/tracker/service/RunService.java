package com.sampleci.tracker.service;

import com.sampleci.tracker.model.*;
import com.sampleci.tracker.progress.RunProgressReport;
import com.sampleci.tracker.progress.RunStateMachine;
import com.sampleci.tracker.repository.CaseOutputComparisonRepository;
import com.sampleci.tracker.repository.CaseResultRepository;
import com.sampleci.tracker.repository.RunEventRepository;
import com.sampleci.tracker.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes a run's event log and results, and reads them back as immutable
 * snapshots for the state machine.
 *
 * This is the single writer of run_events, so the append discipline lives
 * here: nothing may follow a COMPLETED or CANCELED event.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    static final int TOKEN_LENGTH = 64;

    private final RunRepository                  runRepo;
    private final RunEventRepository             eventRepo;
    private final CaseResultRepository           resultRepo;
    private final CaseOutputComparisonRepository comparisonRepo;

    public RunService(RunRepository runRepo,
                      RunEventRepository eventRepo,
                      CaseResultRepository resultRepo,
                      CaseOutputComparisonRepository comparisonRepo) {
        this.runRepo        = runRepo;
        this.eventRepo      = eventRepo;
        this.resultRepo     = resultRepo;
        this.comparisonRepo = comparisonRepo;
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    /** Register a new run. Its event log starts empty. */
    @Transactional
    public Run create(RunPlatform platform, RunType runType, String repositoryUrl,
                      String branch, String commitHash, int prNumber) {
        Run run = runRepo.save(new Run(platform, runType, TokenGenerator.create(TOKEN_LENGTH),
                repositoryUrl, branch, commitHash, prNumber));
        log.info("Created run {} ({} on {}, {})", run.getId(), runType, platform, run.sourceLink());
        return run;
    }

    public Optional<Run> findById(UUID id) {
        return runRepo.findById(id);
    }

    // ------------------------------------------------------------------
    // Event log
    // ------------------------------------------------------------------

    /**
     * Append an event, stamped with the current time.
     *
     * @throws NoSuchElementException      if the run does not exist
     * @throws RunAlreadyFinishedException if the run already finished
     */
    @Transactional
    public StageEvent recordEvent(UUID runId, Stage stage, String message) {
        Run run = runRepo.findById(runId)
                .orElseThrow(() -> new NoSuchElementException("Run not found: " + runId));

        List<StageEvent> history = events(runId);
        if (RunStateMachine.isFinished(history)) {
            Stage last = history.get(history.size() - 1).stage();
            log.warn("Rejected {} event for run {}: run already ended with {}", stage, runId, last);
            throw new RunAlreadyFinishedException(runId, last);
        }
        if (history.isEmpty() && stage != Stage.PREPARATION) {
            log.warn("Run {} starts with {} instead of {}", runId, stage, Stage.PREPARATION);
        }

        RunEvent saved = eventRepo.save(new RunEvent(run, stage, Instant.now(), message));
        if (stage.isTerminal()) {
            log.info("Run {} ended: {} ({})", runId, stage.label(), message);
        } else {
            log.info("Run {} entered {}", runId, stage.label());
        }
        return saved.toStageEvent();
    }

    /** The run's events in insertion order, timestamps normalized to UTC. */
    @Transactional(readOnly = true)
    public List<StageEvent> events(UUID runId) {
        return eventRepo.findByRunIdOrderByIdAsc(runId).stream()
                .map(RunEvent::toStageEvent)
                .toList();
    }

    @Transactional(readOnly = true)
    public RunProgressReport progress(UUID runId) {
        return RunStateMachine.deriveProgress(events(runId));
    }

    @Transactional(readOnly = true)
    public boolean isFinished(UUID runId) {
        return RunStateMachine.isFinished(events(runId));
    }

    @Transactional(readOnly = true)
    public boolean hasFailed(UUID runId) {
        return RunStateMachine.hasFailed(events(runId));
    }

    // ------------------------------------------------------------------
    // Results (reported by the worker while TESTING)
    // ------------------------------------------------------------------

    /** Store or overwrite the exit code and runtime of one case. */
    @Transactional
    public CaseResult recordCaseResult(UUID runId, long caseId, long runtimeMs,
                                       int exitCode, int expectedExitCode) {
        Run run = runRepo.findById(runId)
                .orElseThrow(() -> new NoSuchElementException("Run not found: " + runId));

        CaseResult result = resultRepo.findByRunIdAndCaseId(runId, caseId)
                .map(existing -> {
                    existing.setRuntimeMs(runtimeMs);
                    existing.setExitCode(exitCode);
                    existing.setExpectedExitCode(expectedExitCode);
                    return existing;
                })
                .orElseGet(() -> new CaseResult(run, caseId, runtimeMs, exitCode, expectedExitCode));
        if (!result.exitCodeMatches()) {
            log.info("Run {} case {} exited with {} (expected {})",
                    runId, caseId, exitCode, expectedExitCode);
        }
        return resultRepo.save(result);
    }

    /**
     * Store or overwrite the file refs of one case output.
     * A null actualFileRef records that the output matched.
     *
     * @throws IllegalArgumentException if a ref or the extension is not a plain file name
     */
    @Transactional
    public CaseOutputComparison recordOutputComparison(UUID runId, long caseId, long outputId,
                                                       String expectedFileRef, String actualFileRef,
                                                       String fileExtension) {
        requirePlainName("expectedFileRef", expectedFileRef);
        requirePlainName("actualFileRef", actualFileRef);
        requirePlainName("fileExtension", fileExtension);
        Run run = runRepo.findById(runId)
                .orElseThrow(() -> new NoSuchElementException("Run not found: " + runId));

        CaseOutputComparison comparison = comparisonRepo
                .findByRunIdAndCaseIdAndOutputId(runId, caseId, outputId)
                .map(existing -> {
                    existing.setExpectedFileRef(expectedFileRef);
                    existing.setActualFileRef(actualFileRef);
                    existing.setFileExtension(fileExtension);
                    return existing;
                })
                .orElseGet(() -> new CaseOutputComparison(run, caseId, outputId,
                        expectedFileRef, actualFileRef, fileExtension));
        return comparisonRepo.save(comparison);
    }

    // Refs name files directly inside the artifact directory.
    private static void requirePlainName(String field, String value) {
        if (value == null) return;
        if (value.contains("/") || value.contains("\\") || value.contains("..")) {
            throw new IllegalArgumentException(field + " must be a plain file name: " + value);
        }
    }
}
