package se.snapup_be.exception;

import lombok.Getter;

@Getter
public class DuplicateActiveOfferException extends BusinessLogicException {

    private final Long existingOfferId;

    public DuplicateActiveOfferException(Long existingOfferId) {
        super(ErrorCode.DUPLICATE_ACTIVE_OFFER,
                "An active offer already exists for this listing" +
                        (existingOfferId != null ? " (offer " + existingOfferId + ")" : ""));
        this.existingOfferId = existingOfferId;
    }
}
