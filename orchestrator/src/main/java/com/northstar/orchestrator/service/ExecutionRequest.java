package com.northstar.orchestrator.service;

/**
 * Input of one execution.
 *
 * proposalId is optional (null for ad-hoc executions). baseBranch defaults to "main".
 */
public record ExecutionRequest(String proposalId,
                               String instruction,
                               String updateBlock,
                               String repoFullname,
                               String filePath,
                               String baseBranch) {

    public ExecutionRequest {
        if (baseBranch == null || baseBranch.isBlank()) baseBranch = "main";
        if (updateBlock == null) updateBlock = "";
    }
}
