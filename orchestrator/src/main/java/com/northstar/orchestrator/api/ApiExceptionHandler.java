package com.northstar.orchestrator.api;

import com.northstar.orchestrator.api.dto.ErrorResponse;
import com.northstar.orchestrator.extract.ExtractionException;
import com.northstar.orchestrator.model.IllegalStateTransitionException;
import com.northstar.orchestrator.service.ExecutionFailedException;
import com.northstar.orchestrator.service.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps typed failures to {error, message, ...} JSON bodies.
 *
 * Messages are passed through verbatim: they are written to be read by the
 * person who triggered the request.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<ErrorResponse> extraction(ExtractionException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.getKind().name(), e.getMessage(), e.getSnippet(), null, null));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateTransitionException.class)
    public ResponseEntity<ErrorResponse> illegalTransition(IllegalStateTransitionException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of("ILLEGAL_TRANSITION", e.getMessage()));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> concurrentUpdate(ObjectOptimisticLockingFailureException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of("CONCURRENT_UPDATE", "The resource was changed by another request; reload and retry"));
    }

    @ExceptionHandler(ExecutionFailedException.class)
    public ResponseEntity<ErrorResponse> execution(ExecutionFailedException e) {
        HttpStatus status = e.getKind() == ExecutionFailedException.Kind.INVALID_REQUEST
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.BAD_GATEWAY;
        if (e.getKind() == ExecutionFailedException.Kind.UNAUTHORIZED) {
            log.error("Pull request provider rejected the credentials: {}", e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getKind().name(), e.getMessage(), null, e.getExperimentId(),
                        e.getKind().isRetryable()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("INVALID_REQUEST", e.getMessage()));
    }
}
