package se.snapup_be.pojo.enums;

public enum OfferStatus {
    // Buyer proposed a price, waiting on the seller.
    PENDING,

    // Seller answered with a counter amount, waiting on the buyer.
    COUNTERED,

    ACCEPTED,
    DECLINED,
    WITHDRAWN;

    public boolean isTerminal() {
        return this == ACCEPTED || this == DECLINED || this == WITHDRAWN;
    }

    public boolean isActive() {
        return !isTerminal();
    }
}
