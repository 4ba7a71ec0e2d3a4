package com.demo.chathub.domain;

/**
 * Lifecycle of one client connection. Transitions only move forward.
 */
public enum SessionState {
    CONNECTING,
    AUTHENTICATED,
    ACTIVE,
    CLOSING,
    CLOSED;

    public boolean isTerminating() {
        return this == CLOSING || this == CLOSED;
    }
}
