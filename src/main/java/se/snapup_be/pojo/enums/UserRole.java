package se.snapup_be.pojo.enums;

public enum UserRole {
    USER,
    ADMIN
}
