package com.demo.chathub.handler;

import com.demo.chathub.common.ChatHubException;
import com.demo.chathub.domain.AuthenticatedUser;
import com.demo.chathub.domain.ServerEvent;
import com.demo.chathub.infrastructure.BroadcastHub;
import com.demo.chathub.infrastructure.ConnectionSession;
import com.demo.chathub.infrastructure.SessionManager;
import com.demo.chathub.service.ClientEventDispatcher;
import com.demo.chathub.service.MetricsService;
import com.demo.chathub.service.SessionAuthenticator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.Executor;

/**
 * WebSocket entry point. Authenticates on connect, then owns one
 * {@link ConnectionSession} per socket and feeds it the decoded frames.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String SESSION_ATTRIBUTE = "chatHub.connectionSession";

    private final ObjectMapper objectMapper;
    private final SessionAuthenticator sessionAuthenticator;
    private final SessionManager sessionManager;
    private final BroadcastHub broadcastHub;
    private final ClientEventDispatcher dispatcher;
    private final MetricsService metricsService;
    private final Executor relayExecutor;

    @Value("${chat.protocol-version:1.0}")
    private String protocolVersion;

    @Value("${chat.session.outbound-capacity:100}")
    private int outboundCapacity;

    public ChatWebSocketHandler(ObjectMapper objectMapper,
                                SessionAuthenticator sessionAuthenticator,
                                SessionManager sessionManager,
                                BroadcastHub broadcastHub,
                                ClientEventDispatcher dispatcher,
                                MetricsService metricsService,
                                @Qualifier("relayExecutor") Executor relayExecutor) {
        this.objectMapper = objectMapper;
        this.sessionAuthenticator = sessionAuthenticator;
        this.sessionManager = sessionManager;
        this.broadcastHub = broadcastHub;
        this.dispatcher = dispatcher;
        this.metricsService = metricsService;
        this.relayExecutor = relayExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        AuthenticatedUser user;
        try {
            user = sessionAuthenticator.authenticate(extractToken(wsSession));
        } catch (ChatHubException e) {
            log.warn("WebSocket authentication failed: wsId={}, error={}", wsSession.getId(), e.getMessage());
            sendError(wsSession, e.getMessage());
            wsSession.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        ConnectionSession session = new ConnectionSession(
                wsSession.getId(),
                user,
                new WebSocketOutboundSink(wsSession),
                objectMapper,
                broadcastHub,
                relayExecutor,
                metricsService,
                outboundCapacity);
        wsSession.getAttributes().put(SESSION_ATTRIBUTE, session);

        try {
            session.start(protocolVersion);
            sessionManager.registerSession(session);
        } catch (RuntimeException e) {
            log.error("Error establishing connection: wsId={}, userId={}", wsSession.getId(), user.getId(), e);
            metricsService.recordWebSocketConnection(user.getId(), false);
            metricsService.recordError("CONNECTION_ERROR", "ChatWebSocketHandler");
            session.close();
            wsSession.close(CloseStatus.SERVER_ERROR);
            return;
        }

        log.info("WebSocket connected: wsId={}, userId={}", wsSession.getId(), user.getId());
        metricsService.recordWebSocketConnection(user.getId(), true);
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        ConnectionSession session = connectionSession(wsSession);
        if (session == null || !session.isOpen()) {
            log.debug("Frame on inactive connection ignored: wsId={}", wsSession.getId());
            return;
        }
        dispatcher.handleFrame(session, message.getPayload());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        ConnectionSession session = connectionSession(wsSession);
        log.info("WebSocket closed: wsId={}, status={}", wsSession.getId(), status);
        if (session == null) {
            return;
        }
        session.close();
        sessionManager.unregisterSession(session.getSessionId());
        metricsService.recordWebSocketDisconnection(session.userId());
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.error("WebSocket transport error: wsId={}", wsSession.getId(), exception);
        metricsService.recordError("TRANSPORT_ERROR", "ChatWebSocketHandler");

        ConnectionSession session = connectionSession(wsSession);
        if (session != null) {
            session.close();
        }
    }

    private ConnectionSession connectionSession(WebSocketSession wsSession) {
        Object session = wsSession.getAttributes().get(SESSION_ATTRIBUTE);
        return session instanceof ConnectionSession connectionSession ? connectionSession : null;
    }

    /**
     * Error frame written before a session exists.
     */
    private void sendError(WebSocketSession wsSession, String error) {
        try {
            wsSession.sendMessage(new TextMessage(objectMapper.writeValueAsString(ServerEvent.error(error))));
        } catch (IOException e) {
            log.error("Failed to send error message: wsId={}", wsSession.getId(), e);
        }
    }

    /**
     * Token from the {@code token} query parameter, else the Authorization header.
     */
    String extractToken(WebSocketSession wsSession) {
        URI uri = wsSession.getUri();
        if (uri != null) {
            String token = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
            if (token != null && !token.isBlank()) {
                return token;
            }
        }
        HttpHeaders headers = wsSession.getHandshakeHeaders();
        return headers.getFirst(HttpHeaders.AUTHORIZATION);
    }
}
