package se.snapup_be.service;

public enum ReleaseDecisionType {
    RELEASE,
    WAIT,
    BLOCKED,
    SETTLED
}
