package com.northstar.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A source repository a user has connected.
 *
 * At most one repository per user is active; activation goes through
 * RepositoryService, which deactivates the others in the same transaction.
 *
 * DB table: repositories  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "repositories")
public class ConnectedRepo {

    // owner/name
    @Id
    @Column(name = "repo_fullname")
    private String repoFullname;

    @Column(name = "default_branch", nullable = false)
    private String defaultBranch = "main";

    // Branch PRs are opened against. Usually equal to defaultBranch.
    @Column(name = "base_branch", nullable = false)
    private String baseBranch = "main";

    @Column(name = "is_active", nullable = false)
    private boolean active = false;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ConnectedRepo() {}   // required by JPA

    public ConnectedRepo(String repoFullname, String userId) {
        this.repoFullname = repoFullname;
        this.userId       = userId;
    }

    public String  getRepoFullname()  { return repoFullname; }
    public String  getDefaultBranch() { return defaultBranch; }
    public String  getBaseBranch()    { return baseBranch; }
    public boolean isActive()         { return active; }
    public String  getUserId()        { return userId; }
    public Instant getCreatedAt()     { return createdAt; }

    public void setDefaultBranch(String v) { this.defaultBranch = v; }
    public void setBaseBranch(String v)    { this.baseBranch = v; }
    public void setActive(boolean v)       { this.active = v; }
}
