package com.pnode.pnode_analytics.api;

import com.pnode.pnode_analytics.api.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Last line for errors escaping a controller. Details are logged, never returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // Request errors raised by the framework (bad parameters, unsupported media) keep their status
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        log.debug("Request rejected with {}: {}", status, e.getReason());
        if (status.is5xxServerError()) {
            return handleUnexpected(e);
        }
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String error = resolved != null ? resolved.getReasonPhrase() : "Bad request";
        return new ResponseEntity<>(new ErrorResponse(error, "The request could not be processed"), status);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error while serving request", e);
        return new ResponseEntity<>(ErrorResponse.internal("An unexpected error occurred"), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
