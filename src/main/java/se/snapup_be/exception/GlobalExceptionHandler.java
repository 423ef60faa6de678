package se.snapup_be.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import se.snapup_be.dto.response.ApiResponse;
import se.snapup_be.guard.GuardResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessLogicException.class)
    public ResponseEntity<ApiResponse<Object>> handleBusinessLogic(BusinessLogicException ex) {
        log.warn("Business logic violation [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return build(ex, new LinkedHashMap<>());
    }

    @ExceptionHandler(StaleOfferStateException.class)
    public ResponseEntity<ApiResponse<Object>> handleStaleOffer(StaleOfferStateException ex) {
        log.info("Stale offer command rejected: {}", ex.getMessage());
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (ex.getCurrent() != null) {
            metadata.put("current", ex.getCurrent());
        }
        return build(ex, metadata);
    }

    @ExceptionHandler(DuplicateActiveOfferException.class)
    public ResponseEntity<ApiResponse<Object>> handleDuplicateOffer(DuplicateActiveOfferException ex) {
        log.info("Duplicate offer rejected: {}", ex.getMessage());
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (ex.getExistingOfferId() != null) {
            metadata.put("existingOfferId", ex.getExistingOfferId());
        }
        return build(ex, metadata);
    }

    @ExceptionHandler(GuardRejectedException.class)
    public ResponseEntity<ApiResponse<Object>> handleGuardRejected(GuardRejectedException ex) {
        GuardResult guard = ex.getGuardResult();
        log.info("Message rejected by guard: {} ({})", guard.getVerdict(), guard.getRule());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("guard", guard);

        ResponseEntity<ApiResponse<Object>> response = build(ex, metadata);
        if (guard.getRetryAfterSeconds() != null) {
            return ResponseEntity.status(response.getStatusCode())
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(guard.getRetryAfterSeconds()))
                    .body(response.getBody());
        }
        return response;
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ApiResponse<Object>> handleUpstream(UpstreamUnavailableException ex) {
        log.error("Upstream unavailable: {}", ex.getMessage(), ex);
        return build(ex, new LinkedHashMap<>());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());
        return badRequest("Validation failed", errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        List<String> errors = ex.getConstraintViolations().stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .collect(Collectors.toList());
        return badRequest("Validation failed", errors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = "Invalid value for parameter '" + ex.getName() + "'";
        log.warn("Type mismatch: {}", message);
        return badRequest(message, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());
        return badRequest(ex.getMessage(), null);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiResponse<Object>> handleAccessDenied(AccessDeniedException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ApiResponse.builder()
                        .status(HttpStatus.FORBIDDEN.toString())
                        .message("Access Denied: You do not have the required permissions to perform this action.")
                        .errorCode(ErrorCode.UNAUTHORIZED.name())
                        .retryPolicy(RetryPolicy.NONE.name())
                        .build());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.builder()
                        .status(HttpStatus.CONFLICT.toString())
                        .message("The request conflicts with the current state, refresh and try again")
                        .errorCode(ErrorCode.INVALID_STATE_TRANSITION.name())
                        .retryPolicy(RetryPolicy.REFRESH_THEN_RETRY.name())
                        .build());
    }

    @ExceptionHandler({TransientDataAccessException.class, DataAccessResourceFailureException.class})
    public ResponseEntity<ApiResponse<Object>> handleTransientDataAccess(RuntimeException ex) {
        log.error("Database unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.builder()
                        .status(HttpStatus.SERVICE_UNAVAILABLE.toString())
                        .message("Service temporarily unavailable, please try again")
                        .errorCode(ErrorCode.UPSTREAM_UNAVAILABLE.name())
                        .retryPolicy(RetryPolicy.RETRY_AFTER_REFETCH.name())
                        .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.builder()
                        .status(HttpStatus.INTERNAL_SERVER_ERROR.toString())
                        .message("An unexpected error occurred")
                        .build());
    }

    private ResponseEntity<ApiResponse<Object>> build(BusinessLogicException ex, Map<String, Object> metadata) {
        ErrorCode code = ex.getErrorCode();
        HttpStatus status = code.getHttpStatus().is2xxSuccessful() ? HttpStatus.CONFLICT : code.getHttpStatus();
        return ResponseEntity.status(status)
                .body(ApiResponse.builder()
                        .status(status.toString())
                        .message(ex.getMessage())
                        .errorCode(code.name())
                        .retryPolicy(code.getRetryPolicy().name())
                        .metadata(metadata.isEmpty() ? null : metadata)
                        .build());
    }

    private ResponseEntity<ApiResponse<Object>> badRequest(String message, List<String> errors) {
        return ResponseEntity.badRequest()
                .body(ApiResponse.builder()
                        .status(HttpStatus.BAD_REQUEST.toString())
                        .message(message)
                        .errorCode(ErrorCode.BUSINESS_RULE.name())
                        .retryPolicy(RetryPolicy.NONE.name())
                        .errors(errors)
                        .build());
    }
}
