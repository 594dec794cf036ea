package com.sampleci.tracker.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A run entering a stage (or being canceled). Rows are only ever inserted.
 *
 * DB table: run_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "run_events")
public class RunEvent {

    // Identity column: the id order is the append order.
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private Run run;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Stage stage;

    // TIMESTAMP WITH TIME ZONE in Postgres.
    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    @Column(columnDefinition = "TEXT")
    private String message;

    protected RunEvent() {}   // required by JPA

    public RunEvent(Run run, Stage stage, Instant timestamp, String message) {
        this.run       = run;
        this.stage     = stage;
        this.timestamp = timestamp;
        this.message   = message;
    }

    public Long    getId()        { return id; }
    public Run     getRun()       { return run; }
    public Stage   getStage()     { return stage; }
    public Instant getTimestamp() { return timestamp; }
    public String  getMessage()   { return message; }

    /** Detached, UTC-normalized copy for the state machine. */
    public StageEvent toStageEvent() {
        return StageEvent.of(stage, timestamp, message);
    }
}
