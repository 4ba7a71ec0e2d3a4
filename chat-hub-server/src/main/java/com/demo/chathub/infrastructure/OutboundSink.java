package com.demo.chathub.infrastructure;

import java.io.IOException;

/**
 * Transport a connection session writes serialized frames to.
 * Only the session's writer task calls {@link #send(String)}.
 */
public interface OutboundSink {
    void send(String payload) throws IOException;
    boolean isOpen();
    void close() throws IOException;
}
