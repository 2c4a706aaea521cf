package com.nosota.roundup.exception;

import com.nosota.roundup.dto.ErrorResponse;
import com.nosota.roundup.error.CooldownActiveException;
import com.nosota.roundup.error.InvalidStateException;
import com.nosota.roundup.error.NotFoundException;
import com.nosota.roundup.error.ProcessorException;
import com.nosota.roundup.error.ValidationFailedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            NotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Not found [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(
            InvalidStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Invalid state [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Invalid State", ex.getMessage(), request);
    }

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<ErrorResponse> handleValidationFailed(
            ValidationFailedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Validation failed [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(CooldownActiveException.class)
    public ResponseEntity<ErrorResponse> handleCooldownActive(
            CooldownActiveException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.info("Charity switch cooldown [correlationId={}]: {} day(s) remaining", correlationId, ex.getDaysRemaining());

        ErrorResponse error = ErrorResponse.cooldown(
                HttpStatus.CONFLICT.value(),
                ex.getMessage(),
                request.getRequestURI(),
                ex.getDaysRemaining()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(ProcessorException.class)
    public ResponseEntity<ErrorResponse> handleProcessorError(
            ProcessorException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Payment processor error [correlationId={}, outcomeUnknown={}]: {}",
                correlationId, ex.isOutcomeUnknown(), ex.getMessage());

        return respond(HttpStatus.BAD_GATEWAY, "Payment Processor Error", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Request validation failed [correlationId={}]: {}", MDC.get("correlationId"), message);

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        log.warn("Constraint violation [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(
            Exception ex, HttpServletRequest request) {
        log.warn("Bad request parameter [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request body [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body could not be read", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal argument [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        return respond(HttpStatus.CONFLICT, "Invalid State", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String title, String message,
                                                  HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.of(status.value(), title, message, request.getRequestURI());
        return ResponseEntity.status(status).body(error);
    }
}
