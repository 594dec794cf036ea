package com.sampleci.tracker.api.dto;

import com.sampleci.tracker.model.Stage;
import com.sampleci.tracker.progress.ProgressState;
import com.sampleci.tracker.progress.RunProgressReport;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Response body for GET /runs/{id}/progress. This shape is what the
 * progress bar in the UI is drawn from.
 *
 * <pre>
 * {
 *   "progress": {"state": "ok", "step": 1},
 *   "stages":   [{"value": "preparation", "label": "Preparation"}, ...],
 *   "start":    "2024-05-01T10:00:00Z",
 *   "end":      "unset"
 * }
 * </pre>
 */
public record ProgressResponse(
        Progress        progress,
        List<StageInfo> stages,
        String          start,
        String          end
) {
    public static final String UNSET = "unset";

    public record Progress(ProgressState state, int step) {}

    public record StageInfo(String value, String label) {
        static StageInfo of(Stage stage) {
            return new StageInfo(stage.value(), stage.label());
        }
    }

    public static ProgressResponse from(RunProgressReport report) {
        return new ProgressResponse(
                new Progress(report.state(), report.stepIndex()),
                report.stages().stream().map(StageInfo::of).toList(),
                format(report.start()),
                format(report.end())
        );
    }

    private static String format(Optional<OffsetDateTime> timestamp) {
        return timestamp.map(OffsetDateTime::toString).orElse(UNSET);
    }
}
