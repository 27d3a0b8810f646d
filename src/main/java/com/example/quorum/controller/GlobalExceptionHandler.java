package com.example.quorum.controller;

import com.example.quorum.config.QuorumConfigurationException;
import com.example.quorum.provider.ChatProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Maps service exceptions to JSON error bodies: validation failures to 400,
 * missing rows to 404, provider failures to 502, configuration errors to 500.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> missingParameter(MissingServletRequestParameterException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> status(ResponseStatusException e) {
        return error(e.getStatusCode(), e.getReason() != null ? e.getReason() : e.getMessage());
    }

    @ExceptionHandler(QuorumConfigurationException.class)
    public ResponseEntity<Map<String, Object>> configuration(QuorumConfigurationException e) {
        log.error("Configuration error: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(ChatProviderException.class)
    public ResponseEntity<Map<String, Object>> provider(ChatProviderException e) {
        log.warn("Chat provider call failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", message != null ? message : "Request failed",
                "status", status.value()));
    }
}
