package com.northstar.orchestrator.api.dto;

/** Request body for POST /repositories. Branches default to "main". */
public record ConnectRepositoryRequest(String repoFullname, String defaultBranch,
                                       String baseBranch, String userId) {}
