package com.northstar.orchestrator.model;

import jakarta.persistence.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A candidate code change proposed by the model, waiting for a human decision.
 *
 * Status only moves forward (see {@link ProposalStatus}). The update block is
 * frozen once the proposal leaves PENDING; edits made at approval time live on
 * the Experiment instead.
 *
 * DB table: proposals  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "proposals")
public class Proposal {

    // Assigned by newId(), not generated by the DB.
    @Id
    private String id;

    // Whatever id the model put in its output, if any. Informational only.
    @Column(name = "external_ref")
    private String externalRef;

    @Column(name = "idea_summary", columnDefinition = "TEXT")
    private String ideaSummary;

    @Column(columnDefinition = "TEXT")
    private String rationale;

    private String category;

    @Embedded
    private ExpectedImpact expectedImpact;

    // Order matters: the first entry's file is what gets executed.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "proposal_plan_items", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "position")
    private List<PlanItem> technicalPlan = new ArrayList<>();

    @Column(name = "update_block", columnDefinition = "TEXT", nullable = false)
    private String updateBlock = "";

    @Column(nullable = false)
    private double confidence = 0.5;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProposalStatus status = ProposalStatus.PENDING;

    @Column(name = "repo_fullname", nullable = false)
    private String repoFullname;

    @Column(name = "oauth_session_id")
    private String oauthSessionId;

    // Two concurrent approvals of one proposal: the second save fails.
    @Version
    private long version;

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

    protected Proposal() {}   // required by JPA

    public Proposal(String id, String repoFullname) {
        this.id           = id;
        this.repoFullname = repoFullname;
    }

    /**
     * prop-{epochMillis}-{8 hex of SHA-256(repo)}-{4 random hex}.
     * The random tail keeps two proposals for one repo in the same millisecond apart.
     */
    public static String newId(String repoFullname, Instant now) {
        String repoHash;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(String.valueOf(repoFullname).getBytes(StandardCharsets.UTF_8));
            repoHash = HexFormat.of().formatHex(digest, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        String random = "%04x".formatted(ThreadLocalRandom.current().nextInt(0x10000));
        return "prop-" + now.toEpochMilli() + "-" + repoHash + "-" + random;
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /** @throws IllegalStateTransitionException if {@code next} is not reachable from the current status */
    public void transitionTo(ProposalStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateTransitionException(id, status, next);
        }
        this.status = next;
    }

    /** The file named by the first plan entry, or null when the plan is empty. */
    public String targetFile() {
        return technicalPlan.isEmpty() ? null : technicalPlan.get(0).getFile();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String          getId()             { return id; }
    public String          getExternalRef()    { return externalRef; }
    public String          getIdeaSummary()    { return ideaSummary; }
    public String          getRationale()      { return rationale; }
    public String          getCategory()       { return category; }
    public ExpectedImpact  getExpectedImpact() { return expectedImpact; }
    public List<PlanItem>  getTechnicalPlan()  { return technicalPlan; }
    public String          getUpdateBlock()    { return updateBlock; }
    public double          getConfidence()     { return confidence; }
    public ProposalStatus  getStatus()         { return status; }
    public String          getRepoFullname()   { return repoFullname; }
    public String          getOauthSessionId() { return oauthSessionId; }
    public Instant         getCreatedAt()      { return createdAt; }
    public Instant         getUpdatedAt()      { return updatedAt; }

    public void setExternalRef(String v)              { this.externalRef = v; }
    public void setIdeaSummary(String v)              { this.ideaSummary = v; }
    public void setRationale(String v)                { this.rationale = v; }
    public void setCategory(String v)                 { this.category = v; }
    public void setExpectedImpact(ExpectedImpact v)   { this.expectedImpact = v; }
    public void setOauthSessionId(String v)           { this.oauthSessionId = v; }
    public void setConfidence(double v)               { this.confidence = v; }

    public void setTechnicalPlan(List<PlanItem> items) {
        this.technicalPlan = new ArrayList<>(items);
    }

    public void setUpdateBlock(String updateBlock) {
        if (status != ProposalStatus.PENDING) {
            throw new IllegalStateException("Update block of proposal " + id + " is frozen (status " + status + ")");
        }
        this.updateBlock = updateBlock == null ? "" : updateBlock;
    }
}
