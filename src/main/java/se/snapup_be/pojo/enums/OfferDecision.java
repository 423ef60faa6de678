package se.snapup_be.pojo.enums;

public enum OfferDecision {
    ACCEPT,
    DECLINE
}
