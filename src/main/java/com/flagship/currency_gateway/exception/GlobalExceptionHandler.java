package com.flagship.currency_gateway.exception;

import com.flagship.currency_gateway.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders every failure as {@code { success: false, error, code }} with the
 * HTTP status of its {@link ErrorKind}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CurrencyLedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerException(CurrencyLedgerException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Transaction failed: kind={}, error={}", e.getKind(), e.getMessage());
        } else {
            log.warn("Transaction rejected: kind={}, error={}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e.getMessage(), e.getKind().name()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        String message = errors.isEmpty() ? "Request validation failed" : String.join("; ", errors.values());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(message, ErrorKind.VALIDATION.name(), errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of("Request body is not valid JSON", ErrorKind.VALIDATION.name()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(e.getParameterName() + " is required", ErrorKind.VALIDATION.name()));
    }

    /**
     * Spring MVC's own request errors (unknown path, unsupported method, unsupported media type)
     * keep the status they carry.
     */
    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class, ErrorResponseException.class})
    public ResponseEntity<ErrorResponse> handleFrameworkException(Exception e) {
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) e).getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String code = resolved != null ? resolved.name() : String.valueOf(status.value());
        log.warn("Request rejected: status={}, error={}", status.value(), e.getMessage());
        return ResponseEntity.status(status)
            .body(ErrorResponse.of(resolved != null ? resolved.getReasonPhrase() : e.getMessage(), code));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("An unexpected error occurred", "INTERNAL"));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case REMOTE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case VERSION_CONFLICT -> HttpStatus.CONFLICT;
            case INSUFFICIENT_FUNDS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case PERSISTENCE, COMPENSATION_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
