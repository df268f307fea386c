package com.northstar.orchestrator.github;

/**
 * Thrown when the pull request provider refuses or fails a request.
 *
 * UNAUTHORIZED is by far the most common failure in practice (expired or
 * under-scoped token) and is reported separately so operators spot it.
 */
public class PullRequestException extends RuntimeException {

    public enum Kind { UNAUTHORIZED, REPO_NOT_FOUND, INVALID_REFS, UPSTREAM_ERROR }

    private final Kind    kind;
    private final Integer statusCode;

    public PullRequestException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public PullRequestException(Kind kind, String message, Integer statusCode, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public Kind    getKind()       { return kind; }
    public Integer getStatusCode() { return statusCode; }

    /** Map a GitHub HTTP status to a failure kind. */
    static Kind kindFor(int statusCode) {
        return switch (statusCode) {
            case 401, 403 -> Kind.UNAUTHORIZED;
            case 404      -> Kind.REPO_NOT_FOUND;
            case 422      -> Kind.INVALID_REFS;
            default       -> Kind.UPSTREAM_ERROR;
        };
    }
}
