package com.careerbuddy.bot.exception;

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@ControllerAdvice
public class ExceptionHandler {

    @org.springframework.web.bind.annotation.ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Object> handleBadRequest(@NotNull IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return body("Invalid request", HttpStatus.BAD_REQUEST);
    }

    @org.springframework.web.bind.annotation.ExceptionHandler(SecurityException.class)
    public ResponseEntity<Object> handleSecurityException(@NotNull SecurityException ex) {
        log.warn("Rejected webhook: {}", ex.getMessage());
        return body("Invalid signature", HttpStatus.UNAUTHORIZED);
    }

    @org.springframework.web.bind.annotation.ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Object> handleDataAccessException(@NotNull DataAccessException ex) {
        log.error("Persistence failure: {}", ex.getMessage(), ex);
        return body("Service temporarily unavailable", HttpStatus.SERVICE_UNAVAILABLE);
    }

    @org.springframework.web.bind.annotation.ExceptionHandler(RestClientException.class)
    public ResponseEntity<Object> handleRestClientException(@NotNull RestClientException ex) {
        log.error("Upstream call failed: {}", ex.getMessage());
        return body("Upstream service error", HttpStatus.BAD_GATEWAY);
    }

    @org.springframework.web.bind.annotation.ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGlobalException(@NotNull Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return body("An error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<Object> body(String message, HttpStatus status) {
        Map<String, Object> body = new HashMap<>();
        body.put("message", message);
        body.put("timestamp", System.currentTimeMillis());

        return new ResponseEntity<>(body, status);
    }
}
