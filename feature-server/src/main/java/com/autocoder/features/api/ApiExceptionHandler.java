package com.autocoder.features.api;

import com.autocoder.features.service.FeatureAlreadyPassingException;
import com.autocoder.features.service.FeatureNotFoundException;
import com.autocoder.features.service.FeatureValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns service exceptions into tagged JSON error bodies.
 *
 * The agent reads the "error" field. A store failure keeps its own marker
 * (storeError) so the caller can tell it apart from a rejected request: the
 * transaction was rolled back and nothing was changed.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(FeatureNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(FeatureNotFoundException e) {
        return featureError(HttpStatus.NOT_FOUND, e.getMessage(), e.getFeatureId());
    }

    @ExceptionHandler(FeatureAlreadyPassingException.class)
    public ResponseEntity<Map<String, Object>> alreadyPassing(FeatureAlreadyPassingException e) {
        return featureError(HttpStatus.CONFLICT, e.getMessage(), e.getFeatureId());
    }

    @ExceptionHandler(FeatureValidationException.class)
    public ResponseEntity<Map<String, Object>> invalid(FeatureValidationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        if (e.getIndex() >= 0) {
            body.put("index", e.getIndex());
            body.put("invalidFields", e.getInvalidFields());
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> badArgument(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body: " + e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> storeFailure(DataAccessException e) {
        log.error("Feature store failure, operation rolled back: {}", e.getMessage(), e);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Feature store failure: " + e.getMostSpecificCause().getMessage());
        body.put("storeError", true);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, Object>> ioFailure(UncheckedIOException e) {
        log.error("I/O failure: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> featureError(HttpStatus status, String message, long featureId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("featureId", featureId);
        return ResponseEntity.status(status).body(body);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
