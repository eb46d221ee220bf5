package gov.pmis.budget_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates domain failures and request-binding failures into {@link ApiError} bodies.
 *
 * Storage and driver errors never reach the client verbatim; they fall through to the
 * generic 500 handler, which logs the cause and returns a fixed message.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BudgetLedgerException.class)
    public ResponseEntity<ApiError> handleDomainException(BudgetLedgerException e) {
        HttpStatus status = statusFor(e.getCode());
        if (status.is5xxServerError()) {
            log.warn("Ledger operation failed: code={}, message={}", e.getCode(), e.getMessage());
        } else {
            log.info("Request rejected: code={}, message={}", e.getCode(), e.getMessage());
        }

        ApiError error = ApiError.builder()
            .error(status.getReasonPhrase())
            .code(e.getCode())
            .message(e.getMessage())
            .details(e.getDetails().isEmpty() ? null : e.getDetails())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return badRequest("Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return badRequest("Missing Required Parameter",
            "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, Object> errors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(fieldError ->
            errors.putIfAbsent(fieldError.getField(),
                fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "Invalid value"));

        return badRequest("Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for {}: {}", e.getName(), e.getValue());
        return badRequest("Invalid Request",
            "Invalid value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return badRequest("Malformed Request", "Request body is missing, malformed or has unknown fields", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .code("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(String code) {
        return switch (code) {
            case ValidationException.CODE -> HttpStatus.BAD_REQUEST;
            case NotFoundException.CODE -> HttpStatus.NOT_FOUND;
            case ConflictException.CODE,
                 AlreadyProcessedException.CODE,
                 CannotCancelException.CODE -> HttpStatus.CONFLICT;
            case InsufficientBudgetException.CODE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UnauthorizedApproverException.CODE,
                 UnauthorizedCancelException.CODE -> HttpStatus.FORBIDDEN;
            case LedgerContentionException.CODE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<ApiError> badRequest(String error, String message, Map<String, Object> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .code(ValidationException.CODE)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
