package io.github.drompincen.pocpilot.gateway.controller;

import io.github.drompincen.pocpilot.gateway.security.MissingCallerException;
import io.github.drompincen.pocpilot.protocol.api.AssistantErrorKind;
import io.github.drompincen.pocpilot.protocol.api.ErrorResponse;
import io.github.drompincen.pocpilot.runtime.security.AssistantAccessDeniedException;
import io.github.drompincen.pocpilot.runtime.session.SessionBusyException;
import io.github.drompincen.pocpilot.runtime.session.SessionLimitExceededException;
import io.github.drompincen.pocpilot.runtime.session.SessionNotFoundException;
import io.github.drompincen.pocpilot.runtime.status.AssistantConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MissingCallerException.class)
    public ResponseEntity<ErrorResponse> handleMissingCaller(MissingCallerException e) {
        log.warn("Unauthenticated request: {}", e.getMessage());
        return error(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", e.getMessage());
    }

    @ExceptionHandler(AssistantAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AssistantAccessDeniedException e) {
        log.warn("Access denied: {}", e.getMessage());
        return error(HttpStatus.FORBIDDEN, "FORBIDDEN", e.getMessage());
    }

    @ExceptionHandler(AssistantConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(AssistantConfigurationException e) {
        log.debug("Assistant not ready: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, AssistantErrorKind.CONFIGURATION.name(), e.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, AssistantErrorKind.SESSION_NOT_FOUND.name(), e.getMessage());
    }

    @ExceptionHandler(SessionBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(SessionBusyException e) {
        return error(HttpStatus.CONFLICT, "SESSION_BUSY", e.getMessage());
    }

    @ExceptionHandler(SessionLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleLimit(SessionLimitExceededException e) {
        return error(HttpStatus.CONFLICT, "SESSION_LIMIT", e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }
}
