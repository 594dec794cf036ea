package com.sampleci.tracker.service;

import com.sampleci.tracker.diff.RenderMode;
import com.sampleci.tracker.model.*;
import com.sampleci.tracker.repository.CaseOutputComparisonRepository;
import com.sampleci.tracker.repository.CaseResultRepository;
import com.sampleci.tracker.storage.ArtifactNotFoundException;
import com.sampleci.tracker.storage.DecodingFailureException;
import com.sampleci.tracker.storage.FileSystemArtifactStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ResultAggregator.
 *
 * Repositories are mocked; result files are real files in a temp directory
 * read through FileSystemArtifactStore.
 */
@ExtendWith(MockitoExtension.class)
class ResultAggregatorTest {

    @Mock CaseResultRepository           resultRepo;
    @Mock CaseOutputComparisonRepository comparisonRepo;

    @TempDir Path artifacts;

    SimpleMeterRegistry meterRegistry;
    ResultAggregator    aggregator;
    Run                 run;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        aggregator = new ResultAggregator(resultRepo, comparisonRepo,
                new FileSystemArtifactStore(artifacts.toString()), meterRegistry);
        run = runWithId();
    }

    // ------------------------------------------------------------------
    // passed()
    // ------------------------------------------------------------------

    @Test
    void passed_matchingExitCodeAndOutputs_true() {
        CaseResult result = new CaseResult(run, 1, 10, 0, 0);
        List<CaseOutputComparison> outputs = List.of(comparison(1, 1, "exp", null));

        assertThat(ResultAggregator.passed(result, outputs)).isTrue();
    }

    @Test
    void passed_noOutputsRecorded_dependsOnExitCodeOnly() {
        assertThat(ResultAggregator.passed(new CaseResult(run, 1, 10, 0, 0), List.of())).isTrue();
        assertThat(ResultAggregator.passed(new CaseResult(run, 1, 10, 3, 0), List.of())).isFalse();
    }

    @Test
    void passed_wrongExitCode_falseEvenWithIdenticalOutput() {
        CaseResult result = new CaseResult(run, 1, 10, 139, 0);

        assertThat(ResultAggregator.passed(result, List.of(comparison(1, 1, "exp", null)))).isFalse();
    }

    @Test
    void passed_anyDifferingOutput_false() {
        CaseResult result = new CaseResult(run, 1, 10, 0, 0);
        List<CaseOutputComparison> outputs = List.of(
                comparison(1, 1, "exp1", null),
                comparison(1, 2, "exp2", "got2"));

        assertThat(ResultAggregator.passed(result, outputs)).isFalse();
    }

    // ------------------------------------------------------------------
    // outcomes() / summarize()
    // ------------------------------------------------------------------

    @Test
    void summarize_groupsComparisonsByCase() {
        when(resultRepo.findByRunIdOrderByCaseIdAsc(run.getId())).thenReturn(List.of(
                new CaseResult(run, 1, 10, 0, 0),
                new CaseResult(run, 2, 20, 0, 0),
                new CaseResult(run, 3, 30, 1, 0)));
        when(comparisonRepo.findByRunIdOrderByCaseIdAscOutputIdAsc(run.getId())).thenReturn(List.of(
                comparison(1, 10, "a", null),
                comparison(2, 20, "b", "b-got"),
                comparison(2, 21, "c", null)));

        RunResults results = aggregator.summarize(run.getId());

        assertThat(results.passed()).isEqualTo(1);
        assertThat(results.failed()).isEqualTo(2);
        assertThat(results.cases()).extracting(CaseOutcome::caseId).containsExactly(1L, 2L, 3L);

        CaseOutcome second = results.cases().get(1);
        assertThat(second.passed()).isFalse();
        assertThat(second.exitCodeMatches()).isTrue();
        assertThat(second.differingOutputIds()).containsExactly(20L);

        CaseOutcome third = results.cases().get(2);
        assertThat(third.exitCodeMatches()).isFalse();
        assertThat(third.differingOutputIds()).isEmpty();
    }

    @Test
    void outcome_singleCase_usesOnlyThatCasesComparisons() {
        when(resultRepo.findByRunIdAndCaseId(run.getId(), 2))
                .thenReturn(Optional.of(new CaseResult(run, 2, 20, 0, 0)));
        when(comparisonRepo.findByRunIdAndCaseIdOrderByOutputIdAsc(run.getId(), 2)).thenReturn(List.of(
                comparison(2, 20, "b", "b-got"),
                comparison(2, 21, "c", null)));

        CaseOutcome outcome = aggregator.outcome(run.getId(), 2).orElseThrow();

        assertThat(outcome.caseId()).isEqualTo(2L);
        assertThat(outcome.passed()).isFalse();
        assertThat(outcome.differingOutputIds()).containsExactly(20L);
        verify(resultRepo, never()).findByRunIdOrderByCaseIdAsc(any());
    }

    @Test
    void outcome_noResultRecorded_isEmpty() {
        when(resultRepo.findByRunIdAndCaseId(run.getId(), 9)).thenReturn(Optional.empty());

        assertThat(aggregator.outcome(run.getId(), 9)).isEmpty();
    }

    // ------------------------------------------------------------------
    // diff()
    // ------------------------------------------------------------------

    @Test
    void diff_differingOutput_rendersChangedLine() throws Exception {
        Files.writeString(artifacts.resolve("exp.txt"), "a\nb\nc\n");
        Files.writeString(artifacts.resolve("got.txt"), "a\nx\nc\n");
        stubComparison(comparison(5, 6, "exp", "got"));

        String html = aggregator.diff(run.getId(), 5, 6, RenderMode.INLINE_VIEW);

        assertThat(html).contains("1 changed, 0 added, 0 removed");
        assertThat(meterRegistry.counter("sampleci.diff.requests", "mode", "view", "status", "success").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.timer("sampleci.diff.duration", "mode", "view").count()).isEqualTo(1);
    }

    @Test
    void diff_legacyEncodedFile_isReadThroughFallback() throws Exception {
        Files.write(artifacts.resolve("exp.txt"), new byte[] {'c', 'a', 'f', (byte) 0xE9, '\n'});
        Files.writeString(artifacts.resolve("got.txt"), "cafe\n");
        stubComparison(comparison(5, 6, "exp", "got"));

        String html = aggregator.diff(run.getId(), 5, 6, RenderMode.DOWNLOAD);

        assertThat(html).startsWith("<!DOCTYPE html>");
        assertThat(html).contains("caf<span class=\"diff-del\">é</span>");
    }

    @ParameterizedTest
    @EnumSource(RenderMode.class)
    void diff_actualFileMissing_throwsArtifactNotFound(RenderMode mode) throws Exception {
        Files.writeString(artifacts.resolve("exp.txt"), "a\n");
        stubComparison(comparison(5, 6, "exp", "missing"));

        assertThatThrownBy(() -> aggregator.diff(run.getId(), 5, 6, mode))
                .isInstanceOf(ArtifactNotFoundException.class)
                .hasMessageContaining("missing.txt");
        assertThat(meterRegistry.counter("sampleci.diff.requests",
                "mode", mode.value(), "status", "not_found").count()).isEqualTo(1.0);
    }

    @Test
    void diff_expectedFileMissing_throwsArtifactNotFound() {
        stubComparison(comparison(5, 6, "nothing-here", "got"));

        assertThatThrownBy(() -> aggregator.diff(run.getId(), 5, 6, RenderMode.INLINE_VIEW))
                .isInstanceOf(ArtifactNotFoundException.class);
    }

    @Test
    void diff_corruptFile_throwsDecodingFailure() throws Exception {
        Files.write(artifacts.resolve("exp.txt"), new byte[] {(byte) 0x81});
        Files.writeString(artifacts.resolve("got.txt"), "ok\n");
        stubComparison(comparison(5, 6, "exp", "got"));

        assertThatThrownBy(() -> aggregator.diff(run.getId(), 5, 6, RenderMode.INLINE_VIEW))
                .isInstanceOf(DecodingFailureException.class);
    }

    @Test
    void diff_matchingOutput_isRejected() {
        stubComparison(comparison(5, 6, "exp", null));

        assertThatThrownBy(() -> aggregator.diff(run.getId(), 5, 6, RenderMode.INLINE_VIEW))
                .isInstanceOf(OutputMatchedException.class)
                .hasMessageContaining("no diff");
    }

    @Test
    void diff_unknownComparison_throwsComparisonNotFound() {
        when(comparisonRepo.findByRunIdAndCaseIdAndOutputId(run.getId(), 5, 6)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> aggregator.diff(run.getId(), 5, 6, RenderMode.INLINE_VIEW))
                .isInstanceOf(ComparisonNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Test object factories
    // ------------------------------------------------------------------

    private void stubComparison(CaseOutputComparison comparison) {
        when(comparisonRepo.findByRunIdAndCaseIdAndOutputId(
                run.getId(), comparison.getCaseId(), comparison.getOutputId()))
                .thenReturn(Optional.of(comparison));
    }

    private CaseOutputComparison comparison(long caseId, long outputId, String expected, String actual) {
        return new CaseOutputComparison(run, caseId, outputId, expected, actual, ".txt");
    }

    private Run runWithId() {
        Run r = new Run(RunPlatform.WINDOWS, RunType.COMMIT, "token",
                "https://github.com/org/repo.git", "master", "abc123", 0);
        try {
            var f = r.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(r, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return r;
    }
}
