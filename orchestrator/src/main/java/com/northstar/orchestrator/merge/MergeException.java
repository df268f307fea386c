package com.northstar.orchestrator.merge;

/**
 * Thrown when the Fast-Apply merge service fails or returns nothing usable.
 *
 * SERVICE_ERROR and TIMEOUT are worth retrying by the caller; EMPTY_RESULT
 * usually means the update block did not match the file.
 */
public class MergeException extends RuntimeException {

    public enum Kind { SERVICE_ERROR, TIMEOUT, EMPTY_RESULT }

    private final Kind    kind;
    private final Integer statusCode;
    private final String  upstreamBody;

    public MergeException(Kind kind, String message) {
        this(kind, message, null, null, null);
    }

    public MergeException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public MergeException(Kind kind, String message, Integer statusCode, String upstreamBody, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind         = kind;
        this.statusCode   = statusCode;
        this.upstreamBody = upstreamBody;
    }

    public Kind    getKind()         { return kind; }

    /** HTTP status from the merge service, when one was received. */
    public Integer getStatusCode()   { return statusCode; }
    public String  getUpstreamBody() { return upstreamBody; }
}
