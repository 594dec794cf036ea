package com.sampleci.tracker.repository;

import com.sampleci.tracker.model.CaseOutputComparison;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CaseOutputComparisonRepository extends JpaRepository<CaseOutputComparison, UUID> {

    /** Every output comparison of a run; the aggregator groups them by case. */
    List<CaseOutputComparison> findByRunIdOrderByCaseIdAscOutputIdAsc(UUID runId);

    List<CaseOutputComparison> findByRunIdAndCaseIdOrderByOutputIdAsc(UUID runId, long caseId);

    Optional<CaseOutputComparison> findByRunIdAndCaseIdAndOutputId(UUID runId, long caseId, long outputId);
}
