package com.sampleci.tracker.repository;

import com.sampleci.tracker.model.CaseResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CaseResultRepository extends JpaRepository<CaseResult, UUID> {

    List<CaseResult> findByRunIdOrderByCaseIdAsc(UUID runId);

    Optional<CaseResult> findByRunIdAndCaseId(UUID runId, long caseId);
}
