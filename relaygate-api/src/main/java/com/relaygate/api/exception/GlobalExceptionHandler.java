package com.relaygate.api.exception;

import com.relaygate.api.dto.response.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CompletionFailedException.class)
    public ResponseEntity<ErrorResponse> handleCompletionFailed(
            CompletionFailedException ex,
            WebRequest request
    ) {
        HttpStatus status = ex.getStatus();
        log.warn("[API] Completion failed | kind={} | status={} | error={}",
                ex.getOutcome().getErrorKind(), status.value(), ex.getMessage());

        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("Completion failed")
            .error(ex.getMessage())
            .errorKind(ex.getOutcome().getErrorKind() != null ? ex.getOutcome().getErrorKind().code() : null)
            .provider(ex.getOutcome().getProviderUsed())
            .status(status.value())
            .timestamp(Instant.now())
            .path(path(request))
            .build();

        return ResponseEntity.status(status).body(errorResponse);
    }

    @ExceptionHandler(ProviderNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleProviderNotFound(
            ProviderNotFoundException ex,
            WebRequest request
    ) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("Provider not found")
            .error(ex.getMessage())
            .status(HttpStatus.NOT_FOUND.value())
            .timestamp(Instant.now())
            .path(path(request))
            .build();

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.append(fieldName).append(": ").append(error.getDefaultMessage()).append("; ");
        });

        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("Validation failed")
            .error(errors.toString())
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(path(request))
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("Malformed request body")
            .error(ex.getMostSpecificCause().getMessage())
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(path(request))
            .build();

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);

        ErrorResponse errorResponse = ErrorResponse.builder()
            .message("An unexpected error occurred")
            .error(ex.getMessage())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .timestamp(Instant.now())
            .path(path(request))
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private static String path(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
