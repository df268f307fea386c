package com.northstar.orchestrator.service;

import java.util.UUID;

/**
 * Typed failure of one execution, carrying enough context (repository,
 * branch, instruction, experiment) for an operator to act on it without
 * re-running anything.
 *
 * The message is meant to be shown verbatim.
 */
public class ExecutionFailedException extends RuntimeException {

    public enum Kind {
        // input
        INVALID_REQUEST, FILE_NOT_FOUND,
        // merge service
        MERGE_SERVICE_ERROR, EMPTY_MERGE_RESULT, TIMEOUT,
        // git
        NO_CHANGE_DETECTED, CLONE_FAILED, BASE_BRANCH_MISSING, BRANCH_ALLOCATION_EXHAUSTED,
        PUSH_REJECTED, GIT_ERROR,
        // pull request provider
        UNAUTHORIZED, REPO_NOT_FOUND, INVALID_REFS, UPSTREAM_ERROR,
        INTERNAL;

        /** Whether re-running the same execution later can reasonably succeed. */
        public boolean isRetryable() {
            return switch (this) {
                case MERGE_SERVICE_ERROR, TIMEOUT, PUSH_REJECTED, UPSTREAM_ERROR, CLONE_FAILED -> true;
                default -> false;
            };
        }
    }

    private final Kind   kind;
    private final String repoFullname;
    private final String branch;
    private final String instruction;
    private UUID         experimentId;

    public ExecutionFailedException(Kind kind, String message, String repoFullname,
                                    String branch, String instruction, Throwable cause) {
        super("[" + kind + "] " + message + context(repoFullname, branch, instruction), cause);
        this.kind         = kind;
        this.repoFullname = repoFullname;
        this.branch       = branch;
        this.instruction  = instruction;
    }

    public Kind   getKind()         { return kind; }
    public String getRepoFullname() { return repoFullname; }
    public String getBranch()       { return branch; }
    public String getInstruction()  { return instruction; }
    public UUID   getExperimentId() { return experimentId; }

    void setExperimentId(UUID experimentId) { this.experimentId = experimentId; }

    private static String context(String repo, String branch, String instruction) {
        StringBuilder sb = new StringBuilder(" (repo=").append(repo);
        if (branch != null) sb.append(", branch=").append(branch);
        if (instruction != null) {
            String shown = instruction.length() > 80 ? instruction.substring(0, 80) + "..." : instruction;
            sb.append(", instruction=\"").append(shown).append('"');
        }
        return sb.append(')').toString();
    }
}
