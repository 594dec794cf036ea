package com.sampleci.tracker.service;

import com.sampleci.tracker.diff.DiffEngine;
import com.sampleci.tracker.diff.RenderMode;
import com.sampleci.tracker.model.CaseOutputComparison;
import com.sampleci.tracker.model.CaseResult;
import com.sampleci.tracker.repository.CaseOutputComparisonRepository;
import com.sampleci.tracker.repository.CaseResultRepository;
import com.sampleci.tracker.storage.ArtifactException;
import com.sampleci.tracker.storage.ArtifactNotFoundException;
import com.sampleci.tracker.storage.ArtifactStore;
import com.sampleci.tracker.storage.EncodingFallbackReader;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Assembles the reported outcome of a run from its case results and
 * output comparisons, and produces diffs for outputs that did not match.
 *
 * Diffs are rebuilt on every request. They are cheap next to reading the
 * two files, and nobody looks at the same diff often enough to cache it.
 */
@Service
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final CaseResultRepository           resultRepo;
    private final CaseOutputComparisonRepository comparisonRepo;
    private final ArtifactStore                  artifactStore;
    private final MeterRegistry                  meterRegistry;

    public ResultAggregator(CaseResultRepository resultRepo,
                            CaseOutputComparisonRepository comparisonRepo,
                            ArtifactStore artifactStore,
                            MeterRegistry meterRegistry) {
        this.resultRepo     = resultRepo;
        this.comparisonRepo = comparisonRepo;
        this.artifactStore  = artifactStore;
        this.meterRegistry  = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    /**
     * A case passed when its exit code matched and every one of its outputs
     * was identical to the expected file.
     */
    public static boolean passed(CaseResult result, List<CaseOutputComparison> comparisons) {
        return result.exitCodeMatches()
            && comparisons.stream().allMatch(CaseOutputComparison::outputMatches);
    }

    /** One outcome per recorded case result, ordered by case id. */
    @Transactional(readOnly = true)
    public List<CaseOutcome> outcomes(UUID runId) {
        Map<Long, List<CaseOutputComparison>> byCase =
                comparisonRepo.findByRunIdOrderByCaseIdAscOutputIdAsc(runId).stream()
                        .collect(Collectors.groupingBy(CaseOutputComparison::getCaseId));

        return resultRepo.findByRunIdOrderByCaseIdAsc(runId).stream()
                .map(result -> toOutcome(result, byCase.getOrDefault(result.getCaseId(), List.of())))
                .toList();
    }

    /** The outcome of one case, empty when no result was recorded for it. */
    @Transactional(readOnly = true)
    public Optional<CaseOutcome> outcome(UUID runId, long caseId) {
        return resultRepo.findByRunIdAndCaseId(runId, caseId)
                .map(result -> toOutcome(result,
                        comparisonRepo.findByRunIdAndCaseIdOrderByOutputIdAsc(runId, caseId)));
    }

    @Transactional(readOnly = true)
    public RunResults summarize(UUID runId) {
        return RunResults.of(outcomes(runId));
    }

    private static CaseOutcome toOutcome(CaseResult result, List<CaseOutputComparison> comparisons) {
        List<Long> differing = comparisons.stream()
                .filter(c -> !c.outputMatches())
                .map(CaseOutputComparison::getOutputId)
                .toList();
        return new CaseOutcome(
                result.getCaseId(),
                result.getRuntimeMs(),
                result.getExitCode(),
                result.getExpectedExitCode(),
                result.exitCodeMatches(),
                differing,
                passed(result, comparisons));
    }

    // ------------------------------------------------------------------
    // Diffs
    // ------------------------------------------------------------------

    /**
     * Render the diff between the expected and actual file of one case output.
     *
     * Every call is timed and counted:
     * <pre>
     *   sampleci.diff.duration{mode}
     *   sampleci.diff.requests{mode, status="success|not_found|undecodable|error"}
     * </pre>
     *
     * @throws ComparisonNotFoundException if nothing was recorded for this output
     * @throws OutputMatchedException      if the output matched, so there is nothing to diff
     * @throws ArtifactNotFoundException   if either file is missing
     * @throws com.sampleci.tracker.storage.DecodingFailureException if a file cannot be decoded
     */
    @Transactional(readOnly = true)
    public String diff(UUID runId, long caseId, long outputId, RenderMode mode) {
        CaseOutputComparison comparison = comparisonRepo
                .findByRunIdAndCaseIdAndOutputId(runId, caseId, outputId)
                .orElseThrow(() -> new ComparisonNotFoundException(runId, caseId, outputId));
        if (comparison.outputMatches()) {
            throw new OutputMatchedException(caseId, outputId);
        }

        String basePath = artifactStore.defaultBasePath();
        String modeTag  = mode.value();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            log.debug("Generate diff for {} vs {} in {}",
                    comparison.expectedFileName(), comparison.actualFileName(), basePath);
            List<String> expected = EncodingFallbackReader.readLines(
                    artifactStore, basePath, comparison.expectedFileName());
            List<String> actual = EncodingFallbackReader.readLines(
                    artifactStore, basePath, comparison.actualFileName());
            return DiffEngine.computeDiff(expected, actual, mode);
        } catch (ArtifactNotFoundException e) {
            status = "not_found";
            throw e;
        } catch (ArtifactException e) {
            status = "undecodable";
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("sampleci.diff.duration", "mode", modeTag));
            meterRegistry.counter("sampleci.diff.requests", "mode", modeTag, "status", status).increment();
        }
    }
}
