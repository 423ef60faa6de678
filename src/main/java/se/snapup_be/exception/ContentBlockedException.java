package se.snapup_be.exception;

import se.snapup_be.guard.GuardResult;

public class ContentBlockedException extends GuardRejectedException {

    public ContentBlockedException(GuardResult guardResult) {
        super(ErrorCode.CONTENT_BLOCKED, guardResult);
    }
}
