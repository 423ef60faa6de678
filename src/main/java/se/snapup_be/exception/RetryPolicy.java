package se.snapup_be.exception;

/**
 * What a caller should do after receiving an error of a given code.
 */
public enum RetryPolicy {
    NONE,
    REFRESH_THEN_RETRY,
    RETRY_AFTER_REFETCH,
    WAIT,
    EDIT,
    OVERRIDE,
    BENIGN
}
