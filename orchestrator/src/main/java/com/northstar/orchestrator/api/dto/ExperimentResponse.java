package com.northstar.orchestrator.api.dto;

import com.northstar.orchestrator.model.Experiment;
import com.northstar.orchestrator.model.ExperimentStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for the /experiments endpoints and for approvals.
 *
 * prUrl is set only when status is COMPLETED; failureReason and
 * failureMessage only when it is FAILED. branch may be set either way.
 */
public record ExperimentResponse(
        UUID             id,
        String           proposalId,
        ExperimentStatus status,
        String           instruction,
        String           repoFullname,
        String           filePath,
        String           baseBranch,
        String           branch,
        String           prUrl,
        String           diffSummary,
        String           failureReason,
        String           failureMessage,
        Instant          createdAt,
        Instant          updatedAt
) {
    public static ExperimentResponse from(Experiment e) {
        return new ExperimentResponse(
                e.getId(),
                e.getProposalId(),
                e.getStatus(),
                e.getInstruction(),
                e.getRepoFullname(),
                e.getFilePath(),
                e.getBaseBranch(),
                e.getBranch(),
                e.getPrUrl(),
                e.getDiffSummary(),
                e.getFailureReason(),
                e.getFailureMessage(),
                e.getCreatedAt(),
                e.getUpdatedAt()
        );
    }
}
