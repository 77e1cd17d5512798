package com.loadforecast.exception;

import com.loadforecast.config.RequestGuardFilter;
import com.loadforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, "VALIDATION_FAILED", fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request",
                     "Request body could not be read", request, "MALFORMED_REQUEST", null);
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<ApiError> handleModelNotFound(
            ModelNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({OngoingFlatlinerException.class, InsufficientLoadDataException.class,
                       FallbackSuppressedException.class})
    public ResponseEntity<ApiError> handleInputQuality(
            LoadForecastException ex, HttpServletRequest request) {
        log.warn("Forecast rejected | errorCode={} | {}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Input Data Rejected", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({UnsupportedFallbackStrategyException.class, DataPreparationException.class})
    public ResponseEntity<ApiError> handleJobConfiguration(
            LoadForecastException ex, HttpServletRequest request) {
        log.error("Invalid prediction job configuration | errorCode={} | {}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Job Configuration", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(TooManyMeasurementsException.class)
    public ResponseEntity<ApiError> handleTooManyMeasurements(
            TooManyMeasurementsException ex, HttpServletRequest request) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Request Too Large", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(ColumnOrderException.class)
    public ResponseEntity<ApiError> handleColumnOrder(
            ColumnOrderException ex, HttpServletRequest request) {
        log.error("Column order violated: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Column Order Violation", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String errorCode,
            List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .message(message)
            .errorCode(errorCode)
            .path(request.getRequestURI())
            .requestId(RequestGuardFilter.requestId(request))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
