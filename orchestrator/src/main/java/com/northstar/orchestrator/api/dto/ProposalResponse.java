package com.northstar.orchestrator.api.dto;

import com.northstar.orchestrator.model.Proposal;
import com.northstar.orchestrator.model.ProposalStatus;

import java.time.Instant;
import java.util.List;

/** Response body for the /proposals endpoints. */
public record ProposalResponse(
        String         id,
        String         externalRef,
        ProposalStatus status,
        String         repoFullname,
        String         ideaSummary,
        String         rationale,
        String         category,
        Impact         expectedImpact,
        List<PlanStep> technicalPlan,
        String         updateBlock,
        double         confidence,
        Instant        createdAt,
        Instant        updatedAt
) {
    public record Impact(String metric, double deltaPct) {}

    public record PlanStep(String file, String action) {}

    public static ProposalResponse from(Proposal p) {
        Impact impact = p.getExpectedImpact() == null ? null
                : new Impact(p.getExpectedImpact().getMetric(), p.getExpectedImpact().getDeltaPct());
        return new ProposalResponse(
                p.getId(),
                p.getExternalRef(),
                p.getStatus(),
                p.getRepoFullname(),
                p.getIdeaSummary(),
                p.getRationale(),
                p.getCategory(),
                impact,
                p.getTechnicalPlan().stream()
                        .map(item -> new PlanStep(item.getFile(), item.getAction()))
                        .toList(),
                p.getUpdateBlock(),
                p.getConfidence(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
