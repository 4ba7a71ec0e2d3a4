package com.demo.chathub.domain;

import com.demo.chathub.common.ChatHubException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    USER, ASSISTANT, SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageRole fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw ChatHubException.validation("Message role is required");
        }
        for (MessageRole role : values()) {
            if (role.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return role;
            }
        }
        throw ChatHubException.validation("Unknown message role: " + value);
    }
}
