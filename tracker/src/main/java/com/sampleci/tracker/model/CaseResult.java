package com.sampleci.tracker.model;

import jakarta.persistence.*;
import java.util.UUID;

/**
 * Exit code and runtime of one regression case within a run.
 *
 * A wrong exit code fails the case on its own, independently of
 * any output mismatch.
 *
 * DB table: case_results  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "case_results",
       uniqueConstraints = @UniqueConstraint(columnNames = {"run_id", "case_id"}))
public class CaseResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private Run run;

    @Column(name = "case_id", nullable = false)
    private long caseId;

    @Column(name = "runtime_ms", nullable = false)
    private long runtimeMs;

    @Column(name = "exit_code", nullable = false)
    private int exitCode;

    @Column(name = "expected_exit_code", nullable = false)
    private int expectedExitCode;

    protected CaseResult() {}   // required by JPA

    public CaseResult(Run run, long caseId, long runtimeMs, int exitCode, int expectedExitCode) {
        this.run              = run;
        this.caseId           = caseId;
        this.runtimeMs        = runtimeMs;
        this.exitCode         = exitCode;
        this.expectedExitCode = expectedExitCode;
    }

    public UUID getId()               { return id; }
    public Run  getRun()              { return run; }
    public long getCaseId()           { return caseId; }
    public long getRuntimeMs()        { return runtimeMs; }
    public int  getExitCode()         { return exitCode; }
    public int  getExpectedExitCode() { return expectedExitCode; }

    public void setRuntimeMs(long v)        { this.runtimeMs = v; }
    public void setExitCode(int v)          { this.exitCode = v; }
    public void setExpectedExitCode(int v)  { this.expectedExitCode = v; }

    public boolean exitCodeMatches() {
        return exitCode == expectedExitCode;
    }
}
