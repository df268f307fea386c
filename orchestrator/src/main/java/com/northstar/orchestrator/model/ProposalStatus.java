package com.northstar.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a Proposal.
 *
 * Transitions:
 *   PENDING   → APPROVED | REJECTED
 *   APPROVED  → EXECUTING
 *   EXECUTING → COMPLETED | FAILED
 *
 * REJECTED, COMPLETED and FAILED are terminal.
 */
public enum ProposalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(ProposalStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    private Set<ProposalStatus> successors() {
        return switch (this) {
            case PENDING   -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED  -> EnumSet.of(EXECUTING);
            case EXECUTING -> EnumSet.of(COMPLETED, FAILED);
            case REJECTED, COMPLETED, FAILED -> EnumSet.noneOf(ProposalStatus.class);
        };
    }
}
