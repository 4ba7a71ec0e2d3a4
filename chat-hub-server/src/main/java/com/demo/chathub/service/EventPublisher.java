package com.demo.chathub.service;

import com.demo.chathub.domain.MessageView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes message lifecycle events to Kafka.
 *
 * Enable with: spring.kafka.enabled=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    public static final String MESSAGE_CREATED = "MESSAGE_CREATED";
    public static final String MESSAGE_UPDATED = "MESSAGE_UPDATED";
    public static final String MESSAGE_DELETED = "MESSAGE_DELETED";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;

    @Value("${kafka.topics.chat-events:chat-events}")
    private String chatEventsTopic;

    public EventPublisher(KafkaTemplate<String, Object> kafkaTemplate, MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
    }

    public void publishMessageCreated(MessageView message) {
        Map<String, Object> event = baseEvent(MESSAGE_CREATED, message.getChatId(), message.getId(), message.getUserId());
        event.put("role", message.getRole() != null ? message.getRole().wireName() : null);
        event.put("model", message.getModel());
        event.put("contentLength", message.getContent() != null ? message.getContent().length() : 0);

        publishEvent(message.getChatId(), event, MESSAGE_CREATED);
    }

    public void publishMessageUpdated(MessageView message, long editorId) {
        Map<String, Object> event = baseEvent(MESSAGE_UPDATED, message.getChatId(), message.getId(), editorId);
        event.put("contentLength", message.getContent() != null ? message.getContent().length() : 0);

        publishEvent(message.getChatId(), event, MESSAGE_UPDATED);
    }

    public void publishMessageDeleted(String chatId, String messageId, long actorId) {
        Map<String, Object> event = baseEvent(MESSAGE_DELETED, chatId, messageId, actorId);

        publishEvent(chatId, event, MESSAGE_DELETED);
    }

    private Map<String, Object> baseEvent(String eventType, String chatId, String messageId, long userId) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("chatId", chatId);
        event.put("messageId", messageId);
        event.put("userId", userId);
        return event;
    }

    private void publishEvent(String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(chatEventsTopic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published successfully: type={}, topic={}, partition={}, offset={}",
                        eventType, chatEventsTopic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, chatEventsTopic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });

        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}
