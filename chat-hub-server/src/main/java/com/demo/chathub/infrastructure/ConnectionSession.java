package com.demo.chathub.infrastructure;

import com.demo.chathub.domain.AuthenticatedUser;
import com.demo.chathub.domain.ServerEvent;
import com.demo.chathub.domain.SessionState;
import com.demo.chathub.service.MetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server side of one live connection.
 *
 * All outbound traffic goes through one bounded queue drained by a single writer task,
 * so frames never interleave. One relay task forwards the user's channel into that queue
 * and one more relay runs per chat subscription. A subscribed member sees each broadcast
 * twice (chat channel and user channel); the writer keeps a window of recently written
 * event ids and writes each event once.
 */
@Slf4j
public class ConnectionSession implements EventSink {

    static final int DEDUPE_WINDOW = 256;
    private static final long OFFER_TIMEOUT_MS = 100;

    private final String sessionId;
    private final AuthenticatedUser user;
    private final OutboundSink sink;
    private final ObjectMapper objectMapper;
    private final BroadcastHub hub;
    private final Executor executor;
    private final MetricsService metricsService;

    private final BlockingQueue<ServerEvent> outbound;
    private final ConcurrentHashMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final Instant connectedAt = Instant.now();

    // Touched by the writer task only
    private final Map<String, Boolean> recentlyWritten = new LinkedHashMap<>(DEDUPE_WINDOW, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > DEDUPE_WINDOW;
        }
    };

    private volatile BroadcastChannel<ServerEvent>.Receiver userReceiver;

    public ConnectionSession(String sessionId,
                             AuthenticatedUser user,
                             OutboundSink sink,
                             ObjectMapper objectMapper,
                             BroadcastHub hub,
                             Executor executor,
                             MetricsService metricsService,
                             int outboundCapacity) {
        this.sessionId = sessionId;
        this.user = user;
        this.sink = sink;
        this.objectMapper = objectMapper;
        this.hub = hub;
        this.executor = executor;
        this.metricsService = metricsService;
        this.outbound = new ArrayBlockingQueue<>(outboundCapacity);
    }

    /**
     * Move to ACTIVE: queue {@code hello}, start the writer and attach to the user channel.
     * {@code hello} is queued before anything else can reach the outbound queue.
     */
    public void start(String protocolVersion) {
        if (!state.compareAndSet(SessionState.CONNECTING, SessionState.AUTHENTICATED)) {
            throw new IllegalStateException("Session already started: " + sessionId);
        }

        outbound.add(ServerEvent.hello(protocolVersion, user.getId()));
        executor.execute(this::runWriter);

        BroadcastChannel<ServerEvent>.Receiver receiver = hub.subscribeUser(user.getId());
        userReceiver = receiver;
        executor.execute(() -> runRelay(receiver, null));

        if (!state.compareAndSet(SessionState.AUTHENTICATED, SessionState.ACTIVE)) {
            // closed while starting
            hub.releaseUser(user.getId(), receiver);
            return;
        }
        log.info("Session active: sessionId={}, userId={}", sessionId, user.getId());
    }

    /**
     * Queue an event for this connection. Blocks while the queue is full and the session
     * stays open, so only the connection's own threads (relays and the frame handler)
     * call it.
     *
     * @return false if the session is closing or closed
     */
    public boolean enqueue(ServerEvent event) {
        try {
            while (!state.get().isTerminating()) {
                if (outbound.offer(event, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    /**
     * Queue an event without waiting. A full queue drops the event and counts it.
     */
    @Override
    public boolean deliver(ServerEvent event) {
        if (state.get().isTerminating()) {
            return false;
        }
        if (outbound.offer(event)) {
            return true;
        }
        metricsService.recordOutboundDropped(user.getId(), event.getClass().getSimpleName());
        return false;
    }

    @Override
    public long userId() {
        return user.getId();
    }

    /**
     * Relay a chat receiver into this connection. Replaces and stops any previous relay for
     * the same chat. The session owns {@code receiver} from here on.
     *
     * @return false if the session is already closing; the receiver is closed
     */
    public boolean subscribe(String chatId, long chatKey, BroadcastChannel<ServerEvent>.Receiver receiver) {
        if (state.get().isTerminating()) {
            receiver.close();
            return false;
        }
        Subscription subscription = new Subscription(chatId, chatKey, receiver);
        Subscription previous = subscriptions.put(chatId, subscription);
        if (previous != null) {
            previous.close();
            log.debug("Replaced subscription: sessionId={}, chatId={}", sessionId, chatId);
        }

        // close() may have drained the map between the check above and the put
        if (state.get().isTerminating()) {
            subscriptions.remove(chatId, subscription);
            subscription.close();
            return false;
        }

        executor.execute(() -> runRelay(subscription.receiver, subscription));
        log.info("Subscribed: sessionId={}, userId={}, chatId={}", sessionId, user.getId(), chatId);
        return true;
    }

    /**
     * Drop the subscription if there is one. Idempotent.
     *
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(String chatId) {
        Subscription subscription = subscriptions.remove(chatId);
        if (subscription == null) {
            return false;
        }
        subscription.close();
        log.info("Unsubscribed: sessionId={}, userId={}, chatId={}", sessionId, user.getId(), chatId);
        return true;
    }

    public boolean isSubscribed(String chatId) {
        return subscriptions.containsKey(chatId);
    }

    public Set<String> subscribedChats() {
        return Set.copyOf(subscriptions.keySet());
    }

    /**
     * Tear the session down: release the user channel, stop every relay, stop the writer
     * and close the transport. Safe to call more than once and from any thread.
     */
    public void close() {
        SessionState current;
        do {
            current = state.get();
            if (current.isTerminating()) {
                return;
            }
        } while (!state.compareAndSet(current, SessionState.CLOSING));

        BroadcastChannel<ServerEvent>.Receiver receiver = userReceiver;
        if (receiver != null) {
            hub.releaseUser(user.getId(), receiver);
        }

        subscriptions.values().forEach(Subscription::close);
        subscriptions.clear();
        outbound.clear();

        state.set(SessionState.CLOSED);

        try {
            if (sink.isOpen()) {
                sink.close();
            }
        } catch (IOException e) {
            log.debug("Error closing transport: sessionId={}, error={}", sessionId, e.getMessage());
        }

        log.info("Session closed: sessionId={}, userId={}, connectedFor={}s",
                sessionId, user.getId(), Duration.between(connectedAt, Instant.now()).getSeconds());
    }

    private void runWriter() {
        try {
            while (!state.get().isTerminating()) {
                ServerEvent event = outbound.poll(OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                if (recentlyWritten.put(event.getEventId(), Boolean.TRUE) != null) {
                    continue;
                }
                write(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
        } catch (IOException e) {
            log.warn("Write failed, closing session: sessionId={}, userId={}, error={}",
                    sessionId, user.getId(), e.getMessage());
            close();
        }
    }

    private void write(ServerEvent event) throws IOException {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: sessionId={}, type={}",
                    sessionId, event.getClass().getSimpleName(), e);
            metricsService.recordError("SERIALIZATION_ERROR", "ConnectionSession");
            return;
        }
        sink.send(payload);
        metricsService.recordEventSent();
    }

    /**
     * Forward events from one receiver into the outbound queue until the receiver closes.
     * A chat relay that forwards {@code chat_deleted} for its own chat, or this user's
     * {@code member_removed}, ends its subscription.
     */
    private void runRelay(BroadcastChannel<ServerEvent>.Receiver receiver, Subscription subscription) {
        long lagSeen = 0;
        try {
            while (true) {
                ServerEvent event = receiver.receive();
                if (event == null) {
                    return;
                }

                long lagged = receiver.lagged();
                if (lagged > lagSeen) {
                    metricsService.recordReceiverLag(user.getId(), lagged - lagSeen);
                    lagSeen = lagged;
                }

                if (!enqueue(event)) {
                    return;
                }

                if (subscription != null && endsSubscription(event, subscription.chatId)) {
                    if (subscriptions.remove(subscription.chatId, subscription)) {
                        log.info("Subscription ended: sessionId={}, chatId={}, cause={}",
                                sessionId, subscription.chatId, event.getClass().getSimpleName());
                    }
                    subscription.close();
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * The chat was deleted, or this user was removed from it.
     */
    private boolean endsSubscription(ServerEvent event, String chatId) {
        if (!chatId.equals(event.chatScope())) {
            return false;
        }
        if (event instanceof ServerEvent.ChatDeleted) {
            return true;
        }
        return event instanceof ServerEvent.MemberRemoved removed && removed.getUserId() == user.getId();
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return !state.get().isTerminating();
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    private static final class Subscription {
        private final String chatId;
        private final long chatKey;
        private final BroadcastChannel<ServerEvent>.Receiver receiver;

        private Subscription(String chatId, long chatKey, BroadcastChannel<ServerEvent>.Receiver receiver) {
            this.chatId = chatId;
            this.chatKey = chatKey;
            this.receiver = receiver;
        }

        private void close() {
            receiver.close();
        }

        @Override
        public String toString() {
            return "Subscription{chatId=" + chatId + ", chatKey=" + chatKey + "}";
        }
    }
}
