package com.demo.chathub.controller;

import com.demo.chathub.infrastructure.BroadcastHub;
import com.demo.chathub.infrastructure.SessionManager;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class HealthController {

    private final RedissonClient redissonClient;
    private final SessionManager sessionManager;
    private final BroadcastHub broadcastHub;

    public HealthController(RedissonClient redissonClient,
                            SessionManager sessionManager,
                            BroadcastHub broadcastHub) {
        this.redissonClient = redissonClient;
        this.sessionManager = sessionManager;
        this.broadcastHub = broadcastHub;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");
        response.put("activeConnections", sessionManager.getActiveSessionCount());
        response.put("chatChannels", broadcastHub.chatChannelCount());
        response.put("userChannels", broadcastHub.userChannelCount());

        try {
            redissonClient.getKeys().count();
            response.put("redis", "connected");
        } catch (Exception e) {
            log.warn("Redis health check failed: {}", e.getMessage());
            response.put("redis", "disconnected");
        }

        return response;
    }

    /**
     * Presence of a user across nodes. Session ids stay internal; only their count is exposed.
     */
    @GetMapping("/presence/{userId}")
    public Map<String, Object> presence(@PathVariable long userId) {
        Map<String, Object> response = new HashMap<>();
        response.put("userId", userId);
        response.put("online", sessionManager.isOnline(userId));

        try {
            response.put("sessions", sessionManager.getUserSessions(userId).size());
        } catch (Exception e) {
            log.warn("Presence read failed: userId={}, error={}", userId, e.getMessage());
            response.put("sessions", null);
        }

        return response;
    }
}
