package se.snapup_be.guard;

public enum GuardVerdict {
    ALLOW,
    WARN,
    BLOCK,
    RATE_LIMITED
}
