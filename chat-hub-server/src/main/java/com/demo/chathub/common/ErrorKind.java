package com.demo.chathub.common;

/**
 * Error taxonomy reported to clients as {@code error} frames.
 *
 * Code scheme:
 * - A0xxx: client errors (authentication, permissions, malformed input)
 * - B0xxx: server errors (persistence, serialization)
 * - C0xxx: model provider errors
 */
public enum ErrorKind {

    AUTHENTICATION_FAILED("A0101", "Authentication failed"),

    VALIDATION_FAILED("A0201", "Invalid event format"),

    FORBIDDEN("A0301", "Access denied"),

    NOT_FOUND("A0401", "Resource not found"),

    INTERNAL("B0001", "Failed to process event"),

    PROVIDER_UNAVAILABLE("C0101", "Model provider not available"),

    PROVIDER_FAILED("C0102", "Model completion failed");

    private final String code;
    private final String message;

    ErrorKind(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }
}
