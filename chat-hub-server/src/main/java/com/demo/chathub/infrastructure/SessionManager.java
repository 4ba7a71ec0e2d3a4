package com.demo.chathub.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Presence registry. Tracks live connection sessions locally and mirrors
 * "user X has connections on some node" into Redis so other nodes can see it.
 *
 * Redis is best effort: a failing Redis never breaks a connection, it only makes
 * presence stale until the next refresh.
 */
@Component
@Slf4j
public class SessionManager {

    private static final String USER_PRESENCE_KEY = "presence:user:{userId}";

    private final ConcurrentHashMap<String, ConnectionSession> activeSessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Set<String>> sessionsByUser = new ConcurrentHashMap<>();
    private final RedissonClient redissonClient;
    private final Duration presenceTtl;
    private final ScheduledExecutorService refreshExecutor;

    public SessionManager(RedissonClient redissonClient,
                          @Value("${presence.ttl-minutes:30}") long ttlMinutes) {
        this.redissonClient = redissonClient;
        this.presenceTtl = Duration.ofMinutes(ttlMinutes);
        this.refreshExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "presence-refresh");
            thread.setDaemon(true);
            return thread;
        });

        long period = Math.max(1, presenceTtl.toSeconds() / 2);
        refreshExecutor.scheduleAtFixedRate(this::refreshPresence, period, period, TimeUnit.SECONDS);
    }

    public void registerSession(ConnectionSession session) {
        String sessionId = session.getSessionId();
        long userId = session.userId();

        activeSessions.put(sessionId, session);
        sessionsByUser.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(sessionId);

        try {
            RSet<String> userSessions = presenceSet(userId);
            userSessions.add(sessionId);
            userSessions.expire(presenceTtl);
        } catch (Exception e) {
            log.warn("Failed to publish presence: sessionId={}, userId={}, error={}",
                    sessionId, userId, e.getMessage());
        }

        log.info("Session registered: sessionId={}, userId={}, total={}",
                sessionId, userId, activeSessions.size());
    }

    public void unregisterSession(String sessionId) {
        ConnectionSession session = activeSessions.remove(sessionId);
        if (session == null) {
            return;
        }
        long userId = session.userId();

        sessionsByUser.computeIfPresent(userId, (id, sessions) -> {
            sessions.remove(sessionId);
            return sessions.isEmpty() ? null : sessions;
        });

        try {
            presenceSet(userId).remove(sessionId);
        } catch (Exception e) {
            log.warn("Failed to clear presence: sessionId={}, userId={}, error={}",
                    sessionId, userId, e.getMessage());
        }

        log.info("Session unregistered: sessionId={}, userId={}, duration={}s",
                sessionId, userId,
                Duration.between(session.getConnectedAt(), Instant.now()).getSeconds());
    }

    /**
     * Session ids of the user across all nodes, as last published to Redis.
     */
    public Set<String> getUserSessions(long userId) {
        return new HashSet<>(presenceSet(userId).readAll());
    }

    public boolean isOnline(long userId) {
        if (sessionsByUser.containsKey(userId)) {
            return true;
        }
        try {
            return presenceSet(userId).isExists();
        } catch (Exception e) {
            log.warn("Presence lookup failed: userId={}, error={}", userId, e.getMessage());
            return false;
        }
    }

    public int getActiveSessionCount() {
        return activeSessions.size();
    }

    /**
     * Re-publish local presence and extend its TTL.
     */
    void refreshPresence() {
        sessionsByUser.forEach((userId, sessionIds) -> {
            try {
                RSet<String> userSessions = presenceSet(userId);
                userSessions.addAll(sessionIds);
                userSessions.expire(presenceTtl);
            } catch (Exception e) {
                log.warn("Presence refresh failed: userId={}, error={}", userId, e.getMessage());
            }
        });
        log.debug("Presence refreshed: users={}, sessions={}", sessionsByUser.size(), activeSessions.size());
    }

    private RSet<String> presenceSet(long userId) {
        return redissonClient.getSet(USER_PRESENCE_KEY.replace("{userId}", Long.toString(userId)));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down SessionManager...");
        refreshExecutor.shutdown();
        try {
            if (!refreshExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                refreshExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            refreshExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
