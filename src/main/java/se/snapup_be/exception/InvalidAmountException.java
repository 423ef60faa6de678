package se.snapup_be.exception;

import lombok.Getter;

@Getter
public class InvalidAmountException extends BusinessLogicException {

    private final long amount;
    private final long listingPrice;

    public InvalidAmountException(long amount, long listingPrice) {
        super(ErrorCode.INVALID_AMOUNT,
                String.format("Offer amount %d must be greater than 0 and below the asking price %d", amount, listingPrice));
        this.amount = amount;
        this.listingPrice = listingPrice;
    }
}
