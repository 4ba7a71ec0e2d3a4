package com.demo.chathub.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Canonical message as returned by the store and sent to clients.
 * {@code key} is the internal storage id and never leaves the server.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageView {

    @JsonIgnore
    private long key;

    private String id;

    @JsonProperty("chat_id")
    private String chatId;

    @JsonProperty("user_id")
    private long userId;

    private String content;

    private MessageRole role;

    private String model;

    @JsonProperty("message_type")
    private String messageType;

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("reply_to_id")
    private String replyToId;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
