package com.northstar.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * Body of every error response.
 *
 * error is a machine-readable kind (e.g. UNAUTHORIZED, NO_JSON_FOUND);
 * message is shown to the user verbatim. retryable is only set for
 * execution failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, String snippet, UUID experimentId, Boolean retryable) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null, null, null);
    }
}
