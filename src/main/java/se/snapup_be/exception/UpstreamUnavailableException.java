package se.snapup_be.exception;

public class UpstreamUnavailableException extends BusinessLogicException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
