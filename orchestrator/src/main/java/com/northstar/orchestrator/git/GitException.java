package com.northstar.orchestrator.git;

/**
 * Thrown by the git layer.
 *
 * BASE_BRANCH_MISSING and BRANCH_ALLOCATION_EXHAUSTED are configuration
 * problems and fatal. PUSH_REJECTED means someone else pushed the same branch
 * name first; the orchestrator re-probes once and pushes again.
 */
public class GitException extends RuntimeException {

    public enum Kind { CLONE_FAILED, BASE_BRANCH_MISSING, BRANCH_ALLOCATION_EXHAUSTED, PUSH_REJECTED, GIT_ERROR }

    private final Kind kind;

    public GitException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public GitException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
