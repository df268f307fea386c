package com.northstar.orchestrator.api.dto;

import com.northstar.orchestrator.model.ConnectedRepo;

import java.time.Instant;

public record RepositoryResponse(
        String  repoFullname,
        String  defaultBranch,
        String  baseBranch,
        boolean active,
        String  userId,
        Instant createdAt
) {
    public static RepositoryResponse from(ConnectedRepo r) {
        return new RepositoryResponse(
                r.getRepoFullname(),
                r.getDefaultBranch(),
                r.getBaseBranch(),
                r.isActive(),
                r.getUserId(),
                r.getCreatedAt()
        );
    }
}
