package com.fintech.papertrading.api;

import com.fintech.papertrading.bot.BotException;
import com.fintech.papertrading.ledger.DuplicateAccountException;
import com.fintech.papertrading.ledger.TradeError;
import com.fintech.papertrading.ledger.TradeException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API controllers.
 * Provides consistent error responses across all endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Ledger rejections. Unknown users map to 404, everything else to 400.
     */
    @ExceptionHandler(TradeException.class)
    public ResponseEntity<ErrorResponse> handleTradeRejection(TradeException ex, WebRequest request) {
        HttpStatus status = ex.getError() == TradeError.USER_NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        String path = path(request);
        ErrorResponse error = new ErrorResponse(status.value(), ex.getError().name(), ex.getMessage(), path);

        log.warn("Trade rejected on {}: {}", path, ex.getError());
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(BotException.class)
    public ResponseEntity<ErrorResponse> handleBotRejection(BotException ex, WebRequest request) {
        HttpStatus status = switch (ex.getReason()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
        };
        String path = path(request);
        ErrorResponse error = new ErrorResponse(status.value(), "BOT_" + ex.getReason().name(), ex.getMessage(), path);

        log.warn("Bot request rejected on {}: {}", path, ex.getMessage());
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Missing data: unknown asset, no price yet.
     */
    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoSuchElementException ex, WebRequest request) {
        String path = path(request);
        ErrorResponse error = new ErrorResponse(HttpStatus.NOT_FOUND.value(), "NOT_FOUND", ex.getMessage(), path);

        log.debug("Not found on {}: {}", path, ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(DuplicateAccountException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateAccount(DuplicateAccountException ex, WebRequest request) {
        String path = path(request);
        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT.value(), "CONFLICT", ex.getMessage(), path);

        log.warn("Conflict on {}: {}", path, ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle validation constraint violations on request parameters.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations().stream()
            .map(violation -> new ErrorResponse.ValidationError(
                getFieldName(violation),
                violation.getInvalidValue() != null ? violation.getInvalidValue().toString() : "null",
                violation.getMessage()
            ))
            .collect(Collectors.toList());

        String path = path(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            "Request validation failed",
            path,
            validationErrors
        );

        log.warn("Validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle request body validation failures.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex, WebRequest request) {
        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> new ErrorResponse.ValidationError(
                fieldError.getField(),
                fieldError.getRejectedValue() != null ? fieldError.getRejectedValue().toString() : "null",
                fieldError.getDefaultMessage()
            ))
            .collect(Collectors.toList());

        String path = path(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            "Request validation failed",
            path,
            validationErrors
        );

        log.warn("Body validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex, WebRequest request) {
        List<ErrorResponse.ValidationError> validationErrors = ex.getAllValidationResults().stream()
            .flatMap(result -> result.getResolvableErrors().stream()
                .map(resolvable -> new ErrorResponse.ValidationError(
                    result.getMethodParameter().getParameterName(),
                    result.getArgument() != null ? result.getArgument().toString() : "null",
                    resolvable.getDefaultMessage()
                )))
            .collect(Collectors.toList());

        String path = path(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            "Request validation failed",
            path,
            validationErrors
        );

        log.warn("Parameter validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        String path = path(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "MALFORMED_REQUEST",
            "Request body is missing or malformed",
            path
        );

        log.warn("Unreadable request body on {}: {}", path, ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle missing required parameters.
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {

        String path = path(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "MISSING_PARAMETER",
            String.format("Required parameter '%s' is missing", ex.getParameterName()),
            path,
            List.of(new ErrorResponse.ValidationError(
                ex.getParameterName(),
                null,
                "This parameter is required"
            ))
        );

        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle type conversion errors (e.g., string instead of number).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {

        String path = path(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";

        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "TYPE_MISMATCH",
            String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType),
            path,
            List.of(new ErrorResponse.ValidationError(
                ex.getName(),
                ex.getValue() != null ? ex.getValue().toString() : "null",
                String.format("Expected type: %s", expectedType)
            ))
        );

        log.warn("Type mismatch on {}: {} expected {} but got {}",
                path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle illegal argument exceptions (e.g., invalid interval or indicator).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            WebRequest request) {

        String path = path(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "INVALID_ARGUMENT",
            ex.getMessage(),
            path
        );

        log.warn("Invalid argument on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {

        String path = path(request);
        ErrorResponse error = new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "INTERNAL_ERROR",
            "An unexpected error occurred. Please contact support if this persists.",
            path
        );

        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private String path(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    /**
     * Extract field name from constraint violation.
     */
    private String getFieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
