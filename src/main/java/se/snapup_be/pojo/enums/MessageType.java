package se.snapup_be.pojo.enums;

public enum MessageType {
    CHAT,
    OFFER_NOTICE,
    SYSTEM
}
