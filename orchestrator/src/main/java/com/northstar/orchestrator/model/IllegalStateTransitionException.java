package com.northstar.orchestrator.model;

/**
 * Thrown when a proposal is asked to move to a status its current status
 * does not lead to (e.g. approving an already rejected proposal).
 */
public class IllegalStateTransitionException extends RuntimeException {

    public IllegalStateTransitionException(String proposalId, ProposalStatus from, ProposalStatus to) {
        super("Proposal " + proposalId + " cannot move from " + from + " to " + to);
    }
}
