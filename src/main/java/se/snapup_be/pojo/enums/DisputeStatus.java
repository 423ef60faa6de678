package se.snapup_be.pojo.enums;

public enum DisputeStatus {
    OPEN,
    UNDER_REVIEW,
    RESOLVED_REFUND,
    RESOLVED_PARTIAL_REFUND,
    RESOLVED_NO_REFUND,
    CLOSED;

    public boolean isActive() {
        return this == OPEN || this == UNDER_REVIEW;
    }
}
