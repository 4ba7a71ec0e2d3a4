package com.demo.chathub.infrastructure;

import com.demo.chathub.service.MetricsService;
import com.demo.chathub.support.RecordingSink;
import com.demo.chathub.support.TestObjects;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionManagerTest {

    private ExecutorService executor;
    private RedissonClient redissonClient;
    private RSet<String> presence;
    private SessionManager manager;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        executor = Executors.newCachedThreadPool();
        redissonClient = mock(RedissonClient.class);
        presence = mock(RSet.class);
        when(redissonClient.<String>getSet("presence:user:7")).thenReturn(presence);
        manager = new SessionManager(redissonClient, 30);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
        executor.shutdownNow();
    }

    private ConnectionSession session(String id) {
        return new ConnectionSession(id, TestObjects.user(7L), new RecordingSink(),
                TestObjects.objectMapper(), new BroadcastHub(16), executor, new MetricsService(), 16);
    }

    @Test
    void registrationPublishesPresenceWithTtl() {
        manager.registerSession(session("ws-1"));

        verify(presence).add("ws-1");
        verify(presence).expire(Duration.ofMinutes(30));
        assertThat(manager.getActiveSessionCount()).isEqualTo(1);
        assertThat(manager.isOnline(7L)).isTrue();
    }

    @Test
    void unregisteringLastSessionLeavesUserOfflineLocally() {
        manager.registerSession(session("ws-1"));
        manager.registerSession(session("ws-2"));

        manager.unregisterSession("ws-1");
        assertThat(manager.isOnline(7L)).isTrue();

        manager.unregisterSession("ws-2");
        verify(presence).remove("ws-2");
        assertThat(manager.getActiveSessionCount()).isZero();
        when(presence.isExists()).thenReturn(false);
        assertThat(manager.isOnline(7L)).isFalse();
    }

    @Test
    void presenceOnAnotherNodeCountsAsOnline() {
        when(presence.isExists()).thenReturn(true);
        when(presence.readAll()).thenReturn(Set.of("remote-1"));

        assertThat(manager.isOnline(7L)).isTrue();
        assertThat(manager.getUserSessions(7L)).containsExactly("remote-1");
    }

    @Test
    void redisFailureDoesNotBreakRegistration() {
        doThrow(new IllegalStateException("redis down")).when(presence).add(any());
        when(presence.isExists()).thenThrow(new IllegalStateException("redis down"));

        manager.registerSession(session("ws-1"));
        assertThat(manager.getActiveSessionCount()).isEqualTo(1);

        manager.unregisterSession("ws-1");
        assertThat(manager.isOnline(7L)).isFalse();
    }

    @Test
    void refreshRepublishesLocalSessions() {
        manager.registerSession(session("ws-1"));

        manager.refreshPresence();

        verify(presence).addAll(Set.of("ws-1"));
    }

    @Test
    void unknownSessionIsIgnoredOnUnregister() {
        manager.unregisterSession("nope");

        assertThat(manager.getActiveSessionCount()).isZero();
    }
}
