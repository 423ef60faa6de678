package se.snapup_be.exception;

public class UnauthorizedException extends BusinessLogicException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
