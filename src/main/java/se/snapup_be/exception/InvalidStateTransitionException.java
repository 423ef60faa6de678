package se.snapup_be.exception;

import lombok.Getter;

@Getter
public class InvalidStateTransitionException extends BusinessLogicException {

    private final String currentStatus;
    private final String action;

    public InvalidStateTransitionException(String currentStatus, String action) {
        super(ErrorCode.INVALID_STATE_TRANSITION,
                String.format("Cannot %s while status is %s", action.toLowerCase(), currentStatus));
        this.currentStatus = currentStatus;
        this.action = action;
    }
}
