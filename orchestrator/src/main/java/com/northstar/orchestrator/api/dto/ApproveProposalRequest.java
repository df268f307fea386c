package com.northstar.orchestrator.api.dto;

import com.northstar.orchestrator.service.ApprovalOverrides;

/** Optional body for POST /proposals/{id}/approve. Every field may be omitted. */
public record ApproveProposalRequest(String instruction, String updateBlock, String filePath) {

    public ApprovalOverrides toOverrides() {
        return new ApprovalOverrides(instruction, updateBlock, filePath);
    }
}
