package se.snapup_be.exception;

import se.snapup_be.guard.GuardResult;

public class ContentWarnedException extends GuardRejectedException {

    public ContentWarnedException(GuardResult guardResult) {
        super(ErrorCode.CONTENT_WARNED, guardResult);
    }
}
