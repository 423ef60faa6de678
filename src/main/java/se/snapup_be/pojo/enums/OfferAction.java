package se.snapup_be.pojo.enums;

public enum OfferAction {
    COUNTER,
    ACCEPT,
    DECLINE,
    WITHDRAW
}
