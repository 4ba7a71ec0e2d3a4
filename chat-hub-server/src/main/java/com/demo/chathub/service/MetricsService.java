package com.demo.chathub.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-backed metrics.
 *
 * Counters and gauges live in memory and are written to the log at debug level;
 * business events are logged at info. No external registry.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("✅ MetricsService initialized (log-only)");
    }

    // ===== Counters =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    // ===== Timers =====

    public TimerSample startTimer() {
        return new TimerSample();
    }

    public void recordTimer(String name, Duration duration) {
        log.debug("[METRIC] Timer: {} = {}ms", name, duration.toMillis());
    }

    // ===== Gauges =====

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).decrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Business metrics =====

    public void recordWebSocketConnection(long userId, boolean success) {
        incrementCounter("websocket.connections");
        log.info("📥 WebSocket connection: userId={}, success={}", userId, success);

        if (success) {
            incrementGauge("active_connections");
        }
    }

    public void recordWebSocketDisconnection(long userId) {
        incrementCounter("websocket.disconnections");
        decrementGauge("active_connections");
        log.info("📤 WebSocket disconnection: userId={}", userId);
    }

    public void recordEventReceived(String eventType) {
        incrementCounter("websocket.events.received");
        incrementCounter("websocket.events.received." + eventType);
    }

    public void recordEventSent() {
        incrementCounter("websocket.events.sent");
    }

    public void recordBroadcast(String eventType, int receivers) {
        incrementCounter("broadcast.published");
        log.debug("[METRIC] Broadcast: type={}, receivers={}", eventType, receivers);
    }

    public void recordReceiverLag(long userId, long dropped) {
        incrementCounter("broadcast.lagged");
        log.warn("Receiver lagged: userId={}, dropped={}", userId, dropped);
    }

    public void recordOutboundDropped(long userId, String eventType) {
        incrementCounter("outbound.dropped");
        log.warn("Outbound queue full, event dropped: userId={}, type={}", userId, eventType);
    }

    public void recordCompletion(String model, boolean success, Duration duration) {
        incrementCounter(success ? "completion.succeeded" : "completion.failed");
        recordTimer("completion.duration." + model, duration);
    }

    public void recordAuthenticationAttempt(boolean success) {
        incrementCounter("authentication.attempts");
        if (!success) {
            incrementCounter("authentication.failures");
        }
        log.info("🔐 Auth attempt: success={}", success);
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors");
        log.error("⚠️ Error: type={}, component={}", errorType, component);
    }

    // ===== Accessors =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }

    public static class TimerSample {
        private final long startTime = System.nanoTime();

        public Duration stop() {
            return Duration.ofNanos(System.nanoTime() - startTime);
        }
    }
}
