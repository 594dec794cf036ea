package com.sampleci.tracker.model;

import jakarta.persistence.*;
import java.util.UUID;

/**
 * Expected vs actual output file of one case output.
 *
 * actualFileRef is null when the actual output was byte-identical to the
 * expected one; in that case the actual file is never stored.
 *
 * DB table: case_output_comparisons  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "case_output_comparisons",
       uniqueConstraints = @UniqueConstraint(columnNames = {"run_id", "case_id", "output_id"}))
public class CaseOutputComparison {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private Run run;

    @Column(name = "case_id", nullable = false)
    private long caseId;

    @Column(name = "output_id", nullable = false)
    private long outputId;

    // Which sample was correct at the time the run executed.
    @Column(name = "expected_file_ref", nullable = false, columnDefinition = "TEXT")
    private String expectedFileRef;

    @Column(name = "actual_file_ref", columnDefinition = "TEXT")
    private String actualFileRef;

    // Appended to both refs to get the stored file name, e.g. ".xml".
    @Column(name = "file_extension", nullable = false)
    private String fileExtension = "";

    protected CaseOutputComparison() {}   // required by JPA

    public CaseOutputComparison(Run run, long caseId, long outputId,
                                String expectedFileRef, String actualFileRef, String fileExtension) {
        this.run             = run;
        this.caseId          = caseId;
        this.outputId        = outputId;
        this.expectedFileRef = expectedFileRef;
        this.actualFileRef   = actualFileRef;
        this.fileExtension   = fileExtension == null ? "" : fileExtension;
    }

    public UUID   getId()              { return id; }
    public Run    getRun()             { return run; }
    public long   getCaseId()          { return caseId; }
    public long   getOutputId()        { return outputId; }
    public String getExpectedFileRef() { return expectedFileRef; }
    public String getActualFileRef()   { return actualFileRef; }
    public String getFileExtension()   { return fileExtension; }

    public void setExpectedFileRef(String v) { this.expectedFileRef = v; }
    public void setActualFileRef(String v)   { this.actualFileRef = v; }
    public void setFileExtension(String v)   { this.fileExtension = v == null ? "" : v; }

    public boolean outputMatches() {
        return actualFileRef == null;
    }

    public String expectedFileName() {
        return expectedFileRef + fileExtension;
    }

    public String actualFileName() {
        return actualFileRef + fileExtension;
    }
}
