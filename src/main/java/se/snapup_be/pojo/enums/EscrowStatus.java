package se.snapup_be.pojo.enums;

public enum EscrowStatus {
    PENDING,   // countdown running towards releaseAt
    DISPUTED,  // an active dispute suppresses auto-release
    RELEASED   // funds settled, row is immutable
}
