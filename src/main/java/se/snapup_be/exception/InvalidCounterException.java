package se.snapup_be.exception;

import lombok.Getter;

@Getter
public class InvalidCounterException extends BusinessLogicException {

    private final long counterAmount;
    private final long offerAmount;
    private final long listingPrice;

    public InvalidCounterException(long counterAmount, long offerAmount, long listingPrice) {
        super(ErrorCode.INVALID_COUNTER,
                String.format("Counter amount %d must be above the offer %d and at most the asking price %d",
                        counterAmount, offerAmount, listingPrice));
        this.counterAmount = counterAmount;
        this.offerAmount = offerAmount;
        this.listingPrice = listingPrice;
    }
}
