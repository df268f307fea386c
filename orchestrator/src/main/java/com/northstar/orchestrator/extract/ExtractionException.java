package com.northstar.orchestrator.extract;

/**
 * Thrown when a model response cannot be turned into a proposal.
 *
 * All kinds are terminal for that extraction attempt. The extractor never
 * retries; the caller decides whether to ask the model again.
 */
public class ExtractionException extends RuntimeException {

    public enum Kind { REFUSED_BY_MODEL, NO_JSON_FOUND, UNREPAIRABLE_JSON }

    private static final int SNIPPET_LENGTH = 200;

    private final Kind   kind;
    private final String snippet;

    public ExtractionException(Kind kind, String message, String rawText) {
        this(kind, message, rawText, null);
    }

    public ExtractionException(Kind kind, String message, String rawText, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind    = kind;
        this.snippet = snippet(rawText);
    }

    public Kind   getKind()    { return kind; }

    /** First characters of the raw model output, for diagnosis. */
    public String getSnippet() { return snippet; }

    static String snippet(String rawText) {
        if (rawText == null) return "";
        String s = rawText.strip();
        return s.length() <= SNIPPET_LENGTH ? s : s.substring(0, SNIPPET_LENGTH) + "...";
    }
}
