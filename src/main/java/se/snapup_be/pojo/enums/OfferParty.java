package se.snapup_be.pojo.enums;

public enum OfferParty {
    BUYER,
    SELLER,
    NONE
}
