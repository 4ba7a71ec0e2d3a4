package com.demo.chathub.handler;

import com.demo.chathub.infrastructure.OutboundSink;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link OutboundSink} over a Spring {@link WebSocketSession}.
 */
class WebSocketOutboundSink implements OutboundSink {

    private final WebSocketSession wsSession;

    WebSocketOutboundSink(WebSocketSession wsSession) {
        this.wsSession = wsSession;
    }

    @Override
    public synchronized void send(String payload) throws IOException {
        if (!wsSession.isOpen()) {
            throw new IOException("WebSocket closed: " + wsSession.getId());
        }
        wsSession.sendMessage(new TextMessage(payload));
    }

    @Override
    public boolean isOpen() {
        return wsSession.isOpen();
    }

    @Override
    public void close() throws IOException {
        wsSession.close(CloseStatus.NORMAL);
    }
}
