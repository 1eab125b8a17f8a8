package com.servicedesk.automation.controller;

import com.servicedesk.automation.exception.ConcurrentUpdateException;
import com.servicedesk.automation.exception.InvalidStateException;
import com.servicedesk.automation.exception.TicketNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TicketNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(TicketNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage(), e.getErrorCode());
    }

    // Covers TerminalStateException too
    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<Map<String, String>> handleInvalidState(InvalidStateException e) {
        log.info("Rejected transition: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(ConcurrentUpdateException.class)
    public ResponseEntity<Map<String, String>> handleConcurrentUpdate(ConcurrentUpdateException e) {
        log.warn(e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage(), e.getErrorCode());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), "BAD_REQUEST");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return error(HttpStatus.BAD_REQUEST,
                "Invalid value '" + e.getValue() + "' for parameter " + e.getName(), "BAD_REQUEST");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message, String code) {
        String text = message != null ? message : status.getReasonPhrase();
        return ResponseEntity.status(status).body(Map.of("error", text, "code", code));
    }
}
