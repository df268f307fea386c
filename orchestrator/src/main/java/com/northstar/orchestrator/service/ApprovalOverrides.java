package com.northstar.orchestrator.service;

/**
 * Edits a reviewer may make when approving a proposal. Null fields keep the
 * proposal's own values.
 */
public record ApprovalOverrides(String instruction, String updateBlock, String filePath) {

    public static ApprovalOverrides none() {
        return new ApprovalOverrides(null, null, null);
    }
}
