package com.demo.chathub.infrastructure;

import com.demo.chathub.domain.ServerEvent;
import com.demo.chathub.domain.SessionState;
import com.demo.chathub.service.MetricsService;
import com.demo.chathub.support.RecordingSink;
import com.demo.chathub.support.TestObjects;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class ConnectionSessionTest {

    private ExecutorService executor;
    private BroadcastHub hub;
    private RecordingSink sink;
    private ConnectionSession session;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        hub = new BroadcastHub(16);
        sink = new RecordingSink();
        session = newSession(sink, 7L);
    }

    @AfterEach
    void tearDown() {
        session.close();
        executor.shutdownNow();
    }

    private ConnectionSession newSession(RecordingSink target, long userId) {
        return new ConnectionSession("ws-" + userId, TestObjects.user(userId), target,
                TestObjects.objectMapper(), hub, executor, new MetricsService(), 16);
    }

    @Test
    void helloIsTheFirstFrame() {
        session.start("1.0");
        hub.publishToUser(7L, ServerEvent.error("later"));

        List<JsonNode> frames = sink.awaitType("error", 1);

        assertThat(frames.get(0).path("type").asText()).isEqualTo("hello");
        assertThat(frames.get(0).path("version").asText()).isEqualTo("1.0");
        assertThat(frames.get(0).path("user_id").asLong()).isEqualTo(7L);
        assertThat(session.getState()).isEqualTo(SessionState.ACTIVE);
    }

    @Test
    void startingTwiceFails() {
        session.start("1.0");

        assertThatThrownBy(() -> session.start("1.0")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void userChannelEventsArriveWithoutAnySubscription() {
        session.start("1.0");

        hub.publishToUser(7L, ServerEvent.messageDeleted("c1", "m1"));

        JsonNode frame = sink.awaitType("message_deleted", 1).get(1);
        assertThat(frame.path("chat_id").asText()).isEqualTo("c1");
        assertThat(frame.path("message_id").asText()).isEqualTo("m1");
    }

    @Test
    void eventSeenOnChatAndUserChannelIsWrittenOnce() {
        session.start("1.0");
        session.subscribe("c1", 1L, hub.subscribeChat("c1"));
        ServerEvent event = ServerEvent.messageDeleted("c1", "m1");

        hub.publishToChat("c1", event);
        hub.publishToUser(7L, event);
        session.enqueue(event);
        hub.publishToUser(7L, ServerEvent.error("marker"));

        sink.awaitType("error", 1);
        RecordingSink.settle();
        assertThat(sink.framesOfType("message_deleted")).hasSize(1);
    }

    @Test
    void resubscribeReplacesThePreviousRelay() {
        session.start("1.0");
        BroadcastChannel<ServerEvent> channel = hub.getOrCreateChatChannel("c1");

        session.subscribe("c1", 1L, channel.subscribe());
        session.subscribe("c1", 1L, channel.subscribe());

        assertThat(channel.receiverCount()).isEqualTo(1);
        assertThat(session.subscribedChats()).containsExactly("c1");
    }

    @Test
    void unsubscribeIsIdempotent() {
        session.start("1.0");
        BroadcastChannel<ServerEvent> channel = hub.getOrCreateChatChannel("c1");
        session.subscribe("c1", 1L, channel.subscribe());

        assertThat(session.unsubscribe("c1")).isTrue();
        assertThat(session.unsubscribe("c1")).isFalse();
        assertThat(session.unsubscribe("never")).isFalse();
        assertThat(channel.receiverCount()).isZero();
        assertThat(session.isSubscribed("c1")).isFalse();
    }

    @Test
    void unsubscribedChatEventsNoLongerArrive() {
        session.start("1.0");
        session.subscribe("c1", 1L, hub.subscribeChat("c1"));
        session.unsubscribe("c1");

        hub.publishToChat("c1", ServerEvent.typing("c1", 9L, true));
        hub.publishToUser(7L, ServerEvent.error("marker"));

        sink.awaitType("error", 1);
        RecordingSink.settle();
        assertThat(sink.framesOfType("typing")).isEmpty();
    }

    @Test
    void chatDeletedEndsTheSubscription() {
        session.start("1.0");
        BroadcastChannel<ServerEvent> channel = hub.getOrCreateChatChannel("c1");
        session.subscribe("c1", 1L, channel.subscribe());

        hub.publishToChat("c1", ServerEvent.chatDeleted("c1"));

        sink.awaitType("chat_deleted", 1);
        sink.await(frames -> !session.isSubscribed("c1"), Duration.ofSeconds(5));
        assertThat(channel.receiverCount()).isZero();
    }

    @Test
    void closeReleasesUserChannelAndSubscriptions() {
        session.start("1.0");
        BroadcastChannel<ServerEvent> channel = hub.getOrCreateChatChannel("c1");
        session.subscribe("c1", 1L, channel.subscribe());
        assertThat(hub.hasUserChannel(7L)).isTrue();

        session.close();
        session.close();

        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(hub.hasUserChannel(7L)).isFalse();
        assertThat(channel.receiverCount()).isZero();
        assertThat(sink.isOpen()).isFalse();
        assertThat(session.enqueue(ServerEvent.error("late"))).isFalse();
        BroadcastChannel<ServerEvent>.Receiver late = hub.subscribeChat("c2");
        assertThat(session.subscribe("c2", 2L, late)).isFalse();
        assertThat(late.isClosed()).isTrue();
    }

    @Test
    void otherConnectionOfSameUserKeepsTheUserChannel() {
        RecordingSink otherSink = new RecordingSink();
        ConnectionSession other = newSession(otherSink, 7L);
        session.start("1.0");
        other.start("1.0");

        session.close();
        hub.publishToUser(7L, ServerEvent.error("still here"));

        otherSink.awaitType("error", 1);
        assertThat(hub.hasUserChannel(7L)).isTrue();
        other.close();
        assertThat(hub.hasUserChannel(7L)).isFalse();
    }

    @Test
    void memberRemovedForThisUserEndsTheSubscription() {
        session.start("1.0");
        BroadcastChannel<ServerEvent> channel = hub.getOrCreateChatChannel("c1");
        session.subscribe("c1", 1L, channel.subscribe());

        hub.publishToChat("c1", ServerEvent.memberRemoved("c1", 7L));

        sink.awaitType("member_removed", 1);
        sink.await(frames -> !session.isSubscribed("c1"), Duration.ofSeconds(5));
        assertThat(channel.receiverCount()).isZero();
    }

    @Test
    void memberRemovedForAnotherUserKeepsTheSubscription() {
        session.start("1.0");
        session.subscribe("c1", 1L, hub.subscribeChat("c1"));

        hub.publishToChat("c1", ServerEvent.memberRemoved("c1", 9L));
        hub.publishToChat("c1", ServerEvent.typing("c1", 9L, true));

        sink.awaitType("typing", 1);
        assertThat(sink.framesOfType("member_removed")).hasSize(1);
        assertThat(session.isSubscribed("c1")).isTrue();
    }

    @Test
    void deliverDropsInsteadOfWaitingForAStalledClient() {
        MetricsService metrics = new MetricsService();
        RecordingSink stalled = new RecordingSink();
        stalled.blockWrites();
        ConnectionSession slow = new ConnectionSession("ws-slow", TestObjects.user(8L), stalled,
                TestObjects.objectMapper(), hub, executor, metrics, 1);
        try {
            slow.start("1.0");

            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                for (int i = 0; i < 5; i++) {
                    slow.deliver(ServerEvent.error("late " + i));
                }
            });

            assertThat(metrics.getCounterValue("outbound.dropped")).isGreaterThanOrEqualTo(3);
            assertThat(slow.isOpen()).isTrue();
        } finally {
            stalled.unblockWrites();
            slow.close();
        }
    }

    @Test
    void failedWriteClosesTheSession() {
        session.start("1.0");
        sink.awaitType("hello", 1);

        sink.failWrites();
        session.enqueue(ServerEvent.error("boom"));

        sink.await(frames -> session.getState() == SessionState.CLOSED, Duration.ofSeconds(5));
        assertThat(hub.hasUserChannel(7L)).isFalse();
    }
}
