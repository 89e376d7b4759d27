package com.example.programmers.controller;

import com.example.programmers.exception.ProgrammerNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Error bodies for the programmer API. Validation failures become a map of field name to
 * messages, every other failure a single {@code error} entry.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = ProgrammerController.class)
public class ApiExceptionHandler {

    static final String BASE_ERRORS_KEY = "base";

    // MethodArgumentNotValidException is a BindException, so JSON and form bodies land here
    @ExceptionHandler(BindException.class)
    public ResponseEntity<Map<String, List<String>>> handleValidation(BindException e) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getFieldErrors()) {
            errors.computeIfAbsent(fieldError.getField(), key -> new ArrayList<>())
                .add(fieldError.getDefaultMessage());
        }
        for (ObjectError globalError : e.getGlobalErrors()) {
            errors.computeIfAbsent(BASE_ERRORS_KEY, key -> new ArrayList<>())
                .add(globalError.getDefaultMessage());
        }
        log.warn("Validation failed for {}: {}", e.getObjectName(), errors);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(errors);
    }

    @ExceptionHandler(ProgrammerNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ProgrammerNotFoundException e) {
        log.warn("Programmer not found: id={}", e.getId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for {}: {}", e.getName(), e.getValue());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "Invalid " + e.getName() + ": " + e.getValue()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        log.error("Unexpected failure in programmer API", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "Internal server error"));
    }
}
