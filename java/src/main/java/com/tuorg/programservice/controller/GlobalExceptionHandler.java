package com.tuorg.programservice.controller;

import com.tuorg.programservice.exception.ProgramGenerationException;
import com.tuorg.programservice.exception.ProgramPersistenceException;
import com.tuorg.programservice.exception.ProgramValidationException;
import com.tuorg.programservice.model.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Maps pipeline failures to the {"error", "detail"} body the API uses everywhere. */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ProgramValidationException.class)
    public ResponseEntity<Map<String, Object>> validationFailed(ProgramValidationException ex) {
        List<String> issues = ex.getResult().getErrors().stream()
                .map(ValidationIssue::toString)
                .collect(Collectors.toList());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "Generated program failed validation");
        body.put("detail", ex.getMessage());
        body.put("issues", issues);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(ProgramPersistenceException.class)
    public ResponseEntity<Map<String, Object>> persistenceFailed(ProgramPersistenceException ex) {
        log.error("Program persistence failed: {}", ex.toString(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Program could not be saved", "detail", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(ProgramGenerationException.class)
    public ResponseEntity<Map<String, Object>> generationFailed(ProgramGenerationException ex) {
        log.error("Program generation failed: {}", ex.toString(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Program generation failed", "detail", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidRequest(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(Map.of("error", "Invalid request", "detail", detail));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> illegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "Invalid request", "detail", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "Malformed request body", "detail", String.valueOf(ex.getMostSpecificCause().getMessage())));
    }
}
