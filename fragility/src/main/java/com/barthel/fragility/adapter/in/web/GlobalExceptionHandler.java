package com.barthel.fragility.adapter.in.web;

import com.barthel.fragility.adapter.in.web.dto.ApiError;
import com.barthel.fragility.domain.exception.ClimateDataUnavailableException;
import com.barthel.fragility.domain.exception.ComponentNotFoundException;
import com.barthel.fragility.domain.exception.HbomNotFoundException;
import com.barthel.fragility.domain.exception.HbomStructureException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidCommit(MethodArgumentNotValidException ex,
                                                       HttpServletRequest request) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(request, HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Component tree is invalid", details);
    }

    @ExceptionHandler({HbomNotFoundException.class, ComponentNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        return respond(request, HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(ClimateDataUnavailableException.class)
    public ResponseEntity<ApiError> handleClimateDataUnavailable(ClimateDataUnavailableException ex,
                                                                 HttpServletRequest request) {
        return respond(request, HttpStatus.BAD_REQUEST, "CLIMATE_DATA_UNAVAILABLE", ex.getMessage(),
                "Load climate data for the hazard before computing fragility");
    }

    @ExceptionHandler(HbomStructureException.class)
    public ResponseEntity<ApiError> handleInvalidHierarchy(HbomStructureException ex, HttpServletRequest request) {
        log.warn("Rejected component hierarchy: {}", ex.getMessage());
        return respond(request, HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_HIERARCHY", ex.getMessage(), null);
    }

    @ExceptionHandler(WebClientException.class)
    public ResponseEntity<ApiError> handleClimateServiceFailure(WebClientException ex, HttpServletRequest request) {
        log.error("Climate service call failed", ex);
        return respond(request, HttpStatus.BAD_GATEWAY, "CLIMATE_SERVICE_ERROR", "Climate service call failed",
                ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                         HttpServletRequest request) {
        return respond(request, HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read",
                ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                       HttpServletRequest request) {
        return respond(request, HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT",
                "Invalid value for parameter " + ex.getName(), String.valueOf(ex.getValue()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(request, HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        // framework errors such as unknown routes carry their own status
        if (ex instanceof ErrorResponse frameworkError) {
            HttpStatus status = HttpStatus.valueOf(frameworkError.getStatusCode().value());
            return respond(request, status, status.name(), ex.getMessage(), null);
        }
        log.error("Unhandled exception on {}", request.getRequestURI(), ex);
        return respond(request, HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred", ex.getMessage());
    }

    private static ResponseEntity<ApiError> respond(HttpServletRequest request, HttpStatus status, String code,
                                                    String message, String details) {
        ApiError error = ApiError.builder()
                .code(code)
                .status(status.value())
                .message(message)
                .details(details)
                .path(request.getRequestURI())
                .sector(MDC.get(RequestTraceFilter.MDC_SECTOR))
                .hazard(MDC.get(RequestTraceFilter.MDC_HAZARD))
                .traceId(MDC.get(RequestTraceFilter.MDC_TRACE_ID))
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
