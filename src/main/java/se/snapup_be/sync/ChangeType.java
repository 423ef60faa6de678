package se.snapup_be.sync;

public enum ChangeType {
    INSERT,
    UPDATE
}
