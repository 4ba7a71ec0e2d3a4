package com.demo.chathub.common;

import lombok.Getter;

import java.util.Optional;

/**
 * Base exception for every failure the hub reports back to a client.
 * The message is human readable and ends up verbatim in the {@code error} frame.
 */
@Getter
public class ChatHubException extends RuntimeException {

    private final ErrorKind kind;

    public ChatHubException(ErrorKind kind) {
        this(kind, null, null);
    }

    public ChatHubException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public ChatHubException(ErrorKind kind, String message, Throwable cause) {
        super(Optional.ofNullable(message).orElse(kind.message()), cause);
        this.kind = kind;
    }

    public String getCode() {
        return kind.code();
    }

    public static ChatHubException authenticationFailed(String message) {
        return new ChatHubException(ErrorKind.AUTHENTICATION_FAILED, message);
    }

    public static ChatHubException forbidden(String message) {
        return new ChatHubException(ErrorKind.FORBIDDEN, message);
    }

    public static ChatHubException notFound(String message) {
        return new ChatHubException(ErrorKind.NOT_FOUND, message);
    }

    public static ChatHubException validation(String message) {
        return new ChatHubException(ErrorKind.VALIDATION_FAILED, message);
    }

    public static ChatHubException providerUnavailable(String message) {
        return new ChatHubException(ErrorKind.PROVIDER_UNAVAILABLE, message);
    }

    public static ChatHubException providerFailed(String message, Throwable cause) {
        return new ChatHubException(ErrorKind.PROVIDER_FAILED, message, cause);
    }

    public static ChatHubException internal(String message, Throwable cause) {
        return new ChatHubException(ErrorKind.INTERNAL, message, cause);
    }
}
