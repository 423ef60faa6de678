package se.snapup_be.exception;

import lombok.Getter;
import se.snapup_be.guard.GuardResult;

/**
 * Chat or offer text the guard would not let through. Soft: the UI offers wait, edit or
 * override depending on the subtype.
 */
@Getter
public abstract class GuardRejectedException extends BusinessLogicException {

    private final transient GuardResult guardResult;

    protected GuardRejectedException(ErrorCode errorCode, GuardResult guardResult) {
        super(errorCode, guardResult.getUserMessage());
        this.guardResult = guardResult;
    }
}
