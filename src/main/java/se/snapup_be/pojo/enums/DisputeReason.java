package se.snapup_be.pojo.enums;

public enum DisputeReason {
    ITEM_NOT_RECEIVED,
    ITEM_NOT_AS_DESCRIBED,
    DAMAGED,
    WRONG_ITEM,
    OTHER
}
