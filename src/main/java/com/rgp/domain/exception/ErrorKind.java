package com.rgp.domain.exception;

/**
 * Failure categories exposed to callers.
 * Every rejected operation maps to exactly one kind.
 */
public enum ErrorKind {
    AUTHORIZATION("AUTHORIZATION"),
    NOT_FOUND("NOT_FOUND"),
    STATE("STATE"),
    INSUFFICIENT_RESOURCE("INSUFFICIENT_RESOURCE"),
    TRANSFER("TRANSFER"),
    VALIDATION("VALIDATION");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ErrorKind fromValue(String value) {
        for (ErrorKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown error kind: " + value);
    }
}
