package se.snapup_be.exception;

import lombok.Getter;

/**
 * The offer moved on before this command landed. {@link #getCurrent()} holds the
 * latest stored state for the caller to refresh from.
 */
@Getter
public class StaleOfferStateException extends BusinessLogicException {

    private final transient Object current;

    public StaleOfferStateException(String message, Object current) {
        super(ErrorCode.STALE_OFFER_STATE, message);
        this.current = current;
    }
}
