package se.snapup_be.exception;

import se.snapup_be.guard.GuardResult;

public class RateLimitedException extends GuardRejectedException {

    public RateLimitedException(GuardResult guardResult) {
        super(ErrorCode.RATE_LIMITED, guardResult);
    }
}
