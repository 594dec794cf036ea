package com.sampleci.tracker.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One execution of the regression suite against a commit or pull request
 * on a single platform.
 *
 * A Run owns an append-only list of RunEvents. The run's status is never
 * stored here; it is derived from the events on every read.
 *
 * DB table: runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "runs")
public class Run {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunPlatform platform;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_type", nullable = false)
    private RunType runType;

    // Handed to the worker so it can report progress for this run only.
    @Column(nullable = false, unique = true, length = 64)
    private String token;

    // Clone URL of the fork, e.g. https://github.com/org/repo.git
    @Column(name = "repository_url", nullable = false)
    private String repositoryUrl;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String branch;

    @Column(name = "commit_hash", nullable = false, length = 64)
    private String commitHash;

    // 0 for commit runs.
    @Column(name = "pr_number", nullable = false)
    private int prNumber = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // Insertion order is the event order; identity ids grow monotonically.
    @OneToMany(mappedBy = "run", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    private List<RunEvent> events = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Run() {}   // required by JPA

    public Run(RunPlatform platform, RunType runType, String token,
               String repositoryUrl, String branch, String commitHash, int prNumber) {
        this.platform      = platform;
        this.runType       = runType;
        this.token         = token;
        this.repositoryUrl = repositoryUrl;
        this.branch        = branch;
        this.commitHash    = commitHash;
        this.prNumber      = prNumber;
    }

    // ------------------------------------------------------------------
    // Links
    // ------------------------------------------------------------------

    /** Repository URL without the trailing ".git". */
    public String repositoryLink() {
        return repositoryUrl.endsWith(".git")
                ? repositoryUrl.substring(0, repositoryUrl.length() - 4)
                : repositoryUrl;
    }

    /** Browser link to the commit or pull request this run tested. */
    public String sourceLink() {
        return runType == RunType.COMMIT
                ? repositoryLink() + "/commit/" + commitHash
                : repositoryLink() + "/pull/" + prNumber;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID           getId()            { return id; }
    public RunPlatform    getPlatform()      { return platform; }
    public RunType        getRunType()       { return runType; }
    public String         getToken()         { return token; }
    public String         getRepositoryUrl() { return repositoryUrl; }
    public String         getBranch()        { return branch; }
    public String         getCommitHash()    { return commitHash; }
    public int            getPrNumber()      { return prNumber; }
    public Instant        getCreatedAt()     { return createdAt; }
    public List<RunEvent> getEvents()        { return events; }
}
