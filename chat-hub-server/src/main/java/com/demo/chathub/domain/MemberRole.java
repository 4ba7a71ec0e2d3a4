package com.demo.chathub.domain;

import com.demo.chathub.common.ChatHubException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Role of a user inside one chat.
 */
public enum MemberRole {
    OWNER, ADMIN, MEMBER;

    /**
     * Owners and admins may edit or delete anybody's messages and manage members.
     */
    public boolean canModerate() {
        return this == OWNER || this == ADMIN;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MemberRole fromWire(String value) {
        if (value != null) {
            for (MemberRole role : values()) {
                if (role.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return role;
                }
            }
        }
        throw ChatHubException.validation("Invalid role");
    }
}
