package se.snapup_be.exception;

public class ResourceNotFoundException extends BusinessLogicException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public ResourceNotFoundException(String resource, Object id) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found with id: %s", resource, id));
    }
}
