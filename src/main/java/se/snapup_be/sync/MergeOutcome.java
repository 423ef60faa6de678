package se.snapup_be.sync;

public enum MergeOutcome {
    APPLIED,
    DUPLICATE,
    STALE,
    OUT_OF_SCOPE
}
