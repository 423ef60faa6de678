package se.snapup_be.sync;

public enum EntityType {
    OFFER,
    ORDER,
    ESCROW_HOLD,
    DISPUTE
}
