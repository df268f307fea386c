package com.northstar.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution attempt: merge, branch, commit/push, pull request.
 *
 * Saved as RUNNING before anything touches git, so a crash half-way through
 * still leaves a row to look at. prUrl is only ever set together with
 * COMPLETED; branch is recorded as soon as it is allocated, so a FAILED
 * experiment whose push went through still points at the pushed branch.
 *
 * DB table: experiments  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "experiments")
public class Experiment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Null for ad-hoc executions that did not come from a proposal.
    @Column(name = "proposal_id")
    private String proposalId;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String instruction;

    // A copy; may differ from the proposal's block if it was edited at approval time.
    @Column(name = "update_block", columnDefinition = "TEXT", nullable = false)
    private String updateBlock;

    @Column(name = "repo_fullname", nullable = false)
    private String repoFullname;

    @Column(name = "file_path", nullable = false)
    private String filePath;

    @Column(name = "base_branch", nullable = false)
    private String baseBranch;

    @Column(name = "pr_url")
    private String prUrl;

    private String branch;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExperimentStatus status = ExperimentStatus.RUNNING;

    // ExecutionFailedException.Kind name, e.g. NO_CHANGE_DETECTED.
    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "failure_message", columnDefinition = "TEXT")
    private String failureMessage;

    @Column(name = "diff_summary")
    private String diffSummary;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Experiment() {}   // required by JPA

    public Experiment(String proposalId, String instruction, String updateBlock,
                      String repoFullname, String filePath, String baseBranch) {
        this.proposalId   = proposalId;
        this.instruction  = instruction;
        this.updateBlock  = updateBlock;
        this.repoFullname = repoFullname;
        this.filePath     = filePath;
        this.baseBranch   = baseBranch;
    }

    // ------------------------------------------------------------------
    // Terminal transitions
    // ------------------------------------------------------------------

    public void complete(String prUrl, String branch, String diffSummary) {
        requireRunning();
        this.status      = ExperimentStatus.COMPLETED;
        this.prUrl       = prUrl;
        this.branch      = branch;
        this.diffSummary = diffSummary;
    }

    public void fail(String reason, String message) {
        requireRunning();
        this.status         = ExperimentStatus.FAILED;
        this.prUrl          = null;
        this.failureReason  = reason;
        this.failureMessage = message;
    }

    private void requireRunning() {
        if (status != ExperimentStatus.RUNNING) {
            throw new IllegalStateException("Experiment " + id + " already finished with status " + status);
        }
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID             getId()             { return id; }
    public String           getProposalId()     { return proposalId; }
    public String           getInstruction()    { return instruction; }
    public String           getUpdateBlock()    { return updateBlock; }
    public String           getRepoFullname()   { return repoFullname; }
    public String           getFilePath()       { return filePath; }
    public String           getBaseBranch()     { return baseBranch; }
    public String           getPrUrl()          { return prUrl; }
    public String           getBranch()         { return branch; }
    public ExperimentStatus getStatus()         { return status; }
    public String           getFailureReason()  { return failureReason; }
    public String           getFailureMessage() { return failureMessage; }
    public String           getDiffSummary()    { return diffSummary; }
    public Instant          getCreatedAt()      { return createdAt; }
    public Instant          getUpdatedAt()      { return updatedAt; }

    public void setBranch(String branch)           { this.branch = branch; }
    public void setDiffSummary(String diffSummary) { this.diffSummary = diffSummary; }
}
