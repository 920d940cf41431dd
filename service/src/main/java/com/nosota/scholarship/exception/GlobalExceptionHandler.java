package com.nosota.scholarship.exception;

import com.nosota.scholarship.dto.ErrorResponse;
import com.nosota.scholarship.error.ErrorCoded;
import com.nosota.scholarship.error.IncompleteBankDetailsException;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps exceptions to {@link ErrorResponse} bodies.
 *
 * <ul>
 *   <li>400: validation errors ({@link IllegalArgumentException} family, bean validation, bad headers)</li>
 *   <li>403: {@link AccessDeniedException}</li>
 *   <li>404: {@link EntityNotFoundException} family</li>
 *   <li>409: precondition errors ({@link IllegalStateException} family) and concurrent updates</li>
 *   <li>422: {@link IncompleteBankDetailsException}</li>
 * </ul>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IncompleteBankDetailsException.class)
    public ResponseEntity<ErrorResponse> handleIncompleteBankDetails(
            IncompleteBankDetailsException ex, HttpServletRequest request) {
        log.warn("Incomplete bank details [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Incomplete Bank Details", ex.getCode(), ex.getMessage(),
                request);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(
            EntityNotFoundException ex, HttpServletRequest request) {
        log.warn("Entity not found [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", code(ex, "NOT_FOUND"), ex.getMessage(), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            AccessDeniedException ex, HttpServletRequest request) {
        log.warn("Access denied [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Forbidden", "ACCESS_DENIED", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Validation failed [correlationId={}]: {}", MDC.get("correlationId"), message);
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "INVALID_REQUEST", message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        log.warn("Constraint violation [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "INVALID_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler({ServletRequestBindingException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Malformed request [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "INVALID_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Illegal argument [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", code(ex, "INVALID_REQUEST"), ex.getMessage(),
                request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        log.warn("Illegal state [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", code(ex, "INVALID_STATE"), ex.getMessage(), request);
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrencyFailure(
            ConcurrencyFailureException ex, HttpServletRequest request) {
        log.warn("Concurrent modification [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", "CONCURRENT_MODIFICATION",
                "The record was changed by another request, reload and try again", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String code,
                                                         String message, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, code, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    private static String code(Exception ex, String fallback) {
        return ex instanceof ErrorCoded coded ? coded.getCode() : fallback;
    }
}
