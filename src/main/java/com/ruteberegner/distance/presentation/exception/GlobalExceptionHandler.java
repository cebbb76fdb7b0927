package com.ruteberegner.distance.presentation.exception;

import com.ruteberegner.distance.application.service.DistanceResolutionService.DistanceResolutionException;
import com.ruteberegner.distance.application.service.DistanceResolutionService.GeocodingFailedException;
import com.ruteberegner.distance.domain.service.LocationFormatResolver.InvalidLocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler providing consistent JSON error responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Covers both @ModelAttribute binding (BindException) and @RequestBody validation
     * (MethodArgumentNotValidException is a subclass).
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(BindException ex) {
        logger.debug("Validation error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "VALIDATION_ERROR");

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fieldError -> {
            fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
        });
        error.put("fieldErrors", fieldErrors);
        error.put("message", "Validation failed");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        logger.debug("Missing parameter", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "VALIDATION_ERROR");
        error.put("message", "Missing required parameter: " + ex.getParameterName());
        error.put("parameter", ex.getParameterName());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatchException(MethodArgumentTypeMismatchException ex) {
        logger.debug("Type mismatch error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INVALID_PARAMETER");
        error.put("message", "Invalid parameter type: " + ex.getName());
        error.put("parameter", ex.getName());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.debug("Unreadable request body", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "VALIDATION_ERROR");
        error.put("message", "Malformed request body");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(InvalidLocationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidLocation(InvalidLocationException ex) {
        logger.debug("Invalid location", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INVALID_INPUT");
        error.put("message", ex.getMessage());
        if (ex.getRole() != null) {
            error.put("endpoint", ex.getRole().label());
        }

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.debug("Illegal argument error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INVALID_INPUT");
        error.put("message", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(GeocodingFailedException.class)
    public ResponseEntity<Map<String, Object>> handleGeocodingFailed(GeocodingFailedException ex) {
        logger.warn("Geocoding failed: {}", ex.getMessage());

        Map<String, Object> error = new HashMap<>();
        error.put("error", "GEOCODING_FAILED");
        error.put("message", ex.getMessage());
        error.put("endpoint", ex.getRole().label());
        error.put("reason", ex.getReason().name());
        error.put("location", ex.getLocation());

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(DistanceResolutionException.class)
    public ResponseEntity<Map<String, Object>> handleDistanceResolution(DistanceResolutionException ex) {
        logger.error("Distance resolution error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "DISTANCE_UNRESOLVED");
        error.put("message", ex.getMessage());

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        logger.error("Unexpected error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INTERNAL_ERROR");
        error.put("message", "An unexpected error occurred");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
