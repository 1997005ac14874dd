package quest.gekko.pricewatch.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.pricewatch.exception.DuplicateMemberException;
import quest.gekko.pricewatch.exception.FetchException;
import quest.gekko.pricewatch.exception.GroupNotFoundException;
import quest.gekko.pricewatch.exception.InsufficientMembersException;
import quest.gekko.pricewatch.exception.JobAlreadyRunningException;
import quest.gekko.pricewatch.exception.PriceWatchException;
import quest.gekko.pricewatch.exception.ProductNotFoundException;
import quest.gekko.pricewatch.exception.SnapshotPersistenceException;
import quest.gekko.pricewatch.exception.SourceNotFoundException;
import quest.gekko.pricewatch.exception.UnknownJobException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fe -> ApiError.FieldError.builder()
                        .field(fe.getField())
                        .rejectedValue(fe.getRejectedValue())
                        .message(fe.getDefaultMessage())
                        .build())
                .toList();
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "One or more fields failed validation",
                request, "VALIDATION_FAILED", fieldErrors, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s", ex.getName(),
                ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, "BAD_REQUEST", null, null);
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request, "BAD_REQUEST", null, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURI());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request, "BAD_REQUEST", null, null);
    }

    @ExceptionHandler({ GroupNotFoundException.class, ProductNotFoundException.class,
            UnknownJobException.class, SourceNotFoundException.class })
    public ResponseEntity<ApiError> handleNotFound(PriceWatchException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler({ DuplicateMemberException.class, JobAlreadyRunningException.class })
    public ResponseEntity<ApiError> handleConflict(PriceWatchException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(InsufficientMembersException.class)
    public ResponseEntity<ApiError> handleInsufficientMembers(InsufficientMembersException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Members", ex.getMessage(), request,
                ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<ApiError> handleFetch(FetchException ex, HttpServletRequest request) {
        log.warn("Fetch of {} failed: {}", ex.getProductId(), ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Source Unavailable", ex.getMessage(), request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(SnapshotPersistenceException.class)
    public ResponseEntity<ApiError> handlePersistence(SnapshotPersistenceException ex, HttpServletRequest request) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Persistence Error", ex.getMessage(), request,
                ex.getErrorCode(), null, ex.getResult());
    }

    @ExceptionHandler(PriceWatchException.class)
    public ResponseEntity<ApiError> handleDomain(PriceWatchException ex, HttpServletRequest request) {
        log.error("Unhandled domain error at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", ex.getMessage(), request,
                ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred",
                request, "INTERNAL_ERROR", null, null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String error, String message, HttpServletRequest request,
                                           String code, List<ApiError.FieldError> fieldErrors, Object payload) {
        ApiError body = ApiError.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .code(code)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .fieldErrors(fieldErrors)
                .payload(payload)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
