package com.sampleci.tracker.progress;

import com.sampleci.tracker.model.Stage;
import com.sampleci.tracker.model.StageEvent;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Interprets a run's event log.
 *
 * States (forward only):
 *   PREPARATION → BUILDING → TESTING → COMPLETED
 * with CANCELED reachable from any non-terminal state.
 *
 * Nothing here enforces that order. The writer owns the append discipline;
 * this class reads whatever sequence it is given and always answers from
 * the last element, so out-of-order or repeated stages produce a best-effort
 * report instead of an exception.
 *
 * Pure static functions over an immutable snapshot, safe from any thread.
 */
public final class RunStateMachine {

    private RunStateMachine() {}

    /** True when the last event is COMPLETED or CANCELED. */
    public static boolean isFinished(List<StageEvent> events) {
        return last(events).map(e -> e.stage().isTerminal()).orElse(false);
    }

    /** True when the last event is CANCELED. */
    public static boolean hasFailed(List<StageEvent> events) {
        return last(events).map(e -> e.stage() == Stage.CANCELED).orElse(false);
    }

    /**
     * Build the progress report for a run.
     *
     * A canceled run reports the stage it had reached before the cancel
     * (the second-to-last event), since CANCELED itself is not a step.
     */
    public static RunProgressReport deriveProgress(List<StageEvent> events) {
        if (events == null || events.isEmpty()) {
            return RunProgressReport.unknown();
        }

        StageEvent first = events.get(0);
        StageEvent lastEvent = events.get(events.size() - 1);

        Optional<OffsetDateTime> start = Optional.ofNullable(first.timestamp());
        Optional<OffsetDateTime> end = lastEvent.stage().isTerminal()
                ? Optional.ofNullable(lastEvent.timestamp())
                : Optional.empty();

        ProgressState state;
        int step;
        if (lastEvent.stage() == Stage.CANCELED) {
            state = ProgressState.ERROR;
            step  = events.size() > 1
                    ? Stage.indexOf(events.get(events.size() - 2).stage())
                    : -1;
        } else {
            state = ProgressState.OK;
            step  = Stage.indexOf(lastEvent.stage());
        }
        return new RunProgressReport(state, step, Stage.orderedStages(), start, end);
    }

    private static Optional<StageEvent> last(List<StageEvent> events) {
        if (events == null || events.isEmpty()) return Optional.empty();
        return Optional.of(events.get(events.size() - 1));
    }
}
