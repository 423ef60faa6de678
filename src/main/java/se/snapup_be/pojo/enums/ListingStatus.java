package se.snapup_be.pojo.enums;

public enum ListingStatus {
    ACTIVE,
    PENDING_PAYMENT,
    SOLD,
    INACTIVE
}
