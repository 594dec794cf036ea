package com.sampleci.tracker.repository;

import com.sampleci.tracker.model.Run;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * CRUD operations for the runs table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface RunRepository extends JpaRepository<Run, UUID> {
}
