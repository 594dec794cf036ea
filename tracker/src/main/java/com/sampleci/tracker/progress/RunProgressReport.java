package com.sampleci.tracker.progress;

import com.sampleci.tracker.model.Stage;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Derived progress of a run. Never persisted; rebuilt from the event log on
 * every read.
 *
 * stepIndex indexes into {@link Stage#orderedStages()}; -1 means unknown or
 * not started. start and end are empty while unset.
 */
public record RunProgressReport(
        ProgressState            state,
        int                      stepIndex,
        List<Stage>              stages,
        Optional<OffsetDateTime> start,
        Optional<OffsetDateTime> end
) {
    public static RunProgressReport unknown() {
        return new RunProgressReport(ProgressState.ERROR, -1, Stage.orderedStages(),
                Optional.empty(), Optional.empty());
    }
}
