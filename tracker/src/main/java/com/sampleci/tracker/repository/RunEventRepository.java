package com.sampleci.tracker.repository;

import com.sampleci.tracker.model.RunEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Append and ordered read of a run's event log.
 */
public interface RunEventRepository extends JpaRepository<RunEvent, Long> {

    /** All events of a run in insertion order. */
    List<RunEvent> findByRunIdOrderByIdAsc(UUID runId);
}
