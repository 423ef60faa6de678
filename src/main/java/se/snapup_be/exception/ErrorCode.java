package se.snapup_be.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    INVALID_AMOUNT(RetryPolicy.NONE, HttpStatus.BAD_REQUEST),
    INVALID_COUNTER(RetryPolicy.NONE, HttpStatus.BAD_REQUEST),
    DUPLICATE_ACTIVE_OFFER(RetryPolicy.NONE, HttpStatus.CONFLICT),
    INVALID_STATE_TRANSITION(RetryPolicy.NONE, HttpStatus.CONFLICT),
    STALE_OFFER_STATE(RetryPolicy.REFRESH_THEN_RETRY, HttpStatus.CONFLICT),
    ALREADY_MATERIALIZED(RetryPolicy.BENIGN, HttpStatus.OK),
    ALREADY_HELD(RetryPolicy.BENIGN, HttpStatus.OK),
    RATE_LIMITED(RetryPolicy.WAIT, HttpStatus.TOO_MANY_REQUESTS),
    CONTENT_BLOCKED(RetryPolicy.EDIT, HttpStatus.UNPROCESSABLE_ENTITY),
    CONTENT_WARNED(RetryPolicy.OVERRIDE, HttpStatus.UNPROCESSABLE_ENTITY),
    HOLD_DISPUTE_ACTIVE(RetryPolicy.WAIT, HttpStatus.OK),
    UPSTREAM_UNAVAILABLE(RetryPolicy.RETRY_AFTER_REFETCH, HttpStatus.SERVICE_UNAVAILABLE),
    NOT_FOUND(RetryPolicy.NONE, HttpStatus.NOT_FOUND),
    UNAUTHORIZED(RetryPolicy.NONE, HttpStatus.FORBIDDEN),
    BUSINESS_RULE(RetryPolicy.NONE, HttpStatus.BAD_REQUEST);

    private final RetryPolicy retryPolicy;
    private final HttpStatus httpStatus;

    ErrorCode(RetryPolicy retryPolicy, HttpStatus httpStatus) {
        this.retryPolicy = retryPolicy;
        this.httpStatus = httpStatus;
    }
}
