package com.demo.chathub.infrastructure;

import com.demo.chathub.domain.ServerEvent;

/**
 * Handle for delivering events to one connection.
 */
public interface EventSink {

    /**
     * Hand over an event without blocking the caller.
     *
     * @return false if the event was dropped, because the connection is closing or
     *         cannot keep up
     */
    boolean deliver(ServerEvent event);

    long userId();
}
