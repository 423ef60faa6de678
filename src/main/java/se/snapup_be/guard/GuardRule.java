package se.snapup_be.guard;

public enum GuardRule {
    RATE_LIMIT,
    BLOCKED_CONTENT,
    SUSPICIOUS_PATTERN
}
