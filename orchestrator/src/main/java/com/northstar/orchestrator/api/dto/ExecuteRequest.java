package com.northstar.orchestrator.api.dto;

import com.northstar.orchestrator.service.ExecutionRequest;

/**
 * Request body for POST /experiments (ad-hoc execution without a proposal).
 *
 * Required: instruction, updateBlock, repoFullname, filePath
 * Optional: baseBranch, defaults to "main"
 */
public record ExecuteRequest(String instruction, String updateBlock, String repoFullname,
                             String filePath, String baseBranch) {

    public ExecutionRequest toExecutionRequest() {
        return new ExecutionRequest(null, instruction, updateBlock, repoFullname, filePath, baseBranch);
    }
}
