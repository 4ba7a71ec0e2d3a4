package com.demo.chathub.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Server → client frames. Serialized as one JSON object tagged by {@code type}.
 *
 * Every instance carries a server-side event id that is never serialized. A session may
 * receive the same broadcast through its chat subscription and its user channel; the
 * session writer uses the id to write each event at most once.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ServerEvent.Hello.class, name = "hello"),
        @JsonSubTypes.Type(value = ServerEvent.Error.class, name = "error"),
        @JsonSubTypes.Type(value = ServerEvent.Subscribed.class, name = "subscribed"),
        @JsonSubTypes.Type(value = ServerEvent.Unsubscribed.class, name = "unsubscribed"),
        @JsonSubTypes.Type(value = ServerEvent.MessagePosted.class, name = "message"),
        @JsonSubTypes.Type(value = ServerEvent.MessageUpdated.class, name = "message_updated"),
        @JsonSubTypes.Type(value = ServerEvent.MessageDeleted.class, name = "message_deleted"),
        @JsonSubTypes.Type(value = ServerEvent.Typing.class, name = "typing"),
        @JsonSubTypes.Type(value = ServerEvent.MessageList.class, name = "messages"),
        @JsonSubTypes.Type(value = ServerEvent.MessageEditList.class, name = "message_edits"),
        @JsonSubTypes.Type(value = ServerEvent.ChatCreated.class, name = "chat_created"),
        @JsonSubTypes.Type(value = ServerEvent.ChatDeleted.class, name = "chat_deleted"),
        @JsonSubTypes.Type(value = ServerEvent.MemberList.class, name = "members"),
        @JsonSubTypes.Type(value = ServerEvent.MemberUpdated.class, name = "member_updated"),
        @JsonSubTypes.Type(value = ServerEvent.MemberRemoved.class, name = "member_removed"),
        @JsonSubTypes.Type(value = ServerEvent.Pong.class, name = "pong")
})
public abstract class ServerEvent {

    @JsonIgnore
    private final String eventId = UUID.randomUUID().toString();

    @JsonIgnore
    public String getEventId() {
        return eventId;
    }

    /**
     * Chat this event belongs to, or {@code null} for connection-level events.
     */
    @JsonIgnore
    public String chatScope() {
        return null;
    }

    // Factory methods

    public static Hello hello(String version, long userId) {
        return new Hello(version, userId);
    }

    public static Error error(String message) {
        return new Error(message);
    }

    public static Subscribed subscribed(String chatId) {
        return new Subscribed(chatId);
    }

    public static Unsubscribed unsubscribed(String chatId) {
        return new Unsubscribed(chatId);
    }

    public static MessagePosted messagePosted(MessageView message) {
        return new MessagePosted(
                message.getChatId(),
                message.getId(),
                message.getUserId(),
                message.getContent(),
                message.getModel(),
                message.getCreatedAt() != null ? message.getCreatedAt().toString() : null,
                message.getMessageType());
    }

    public static MessageUpdated messageUpdated(MessageView message) {
        return new MessageUpdated(message.getChatId(), message);
    }

    public static MessageDeleted messageDeleted(String chatId, String messageId) {
        return new MessageDeleted(chatId, messageId);
    }

    public static Typing typing(String chatId, long userId, boolean typing) {
        return new Typing(chatId, userId, typing);
    }

    public static ChatDeleted chatDeleted(String chatId) {
        return new ChatDeleted(chatId);
    }

    public static MemberUpdated memberUpdated(MemberView member) {
        return new MemberUpdated(member.getChatId(), member);
    }

    public static MemberRemoved memberRemoved(String chatId, long userId) {
        return new MemberRemoved(chatId, userId);
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Hello extends ServerEvent {
        private String version;
        @JsonProperty("user_id")
        private long userId;
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Error extends ServerEvent {
        private String message;
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Subscribed extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Unsubscribed extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessagePosted extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("message_id")
        private String messageId;
        @JsonProperty("user_id")
        private long userId;
        private String content;
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private String model;
        private String timestamp;
        @JsonProperty("message_type")
        private String messageType;

        @Override
        public String chatScope() {
            return chatId;
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageUpdated extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
        private MessageView message;

        @Override
        public String chatScope() {
            return chatId;
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageDeleted extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("message_id")
        private String messageId;

        @Override
        public String chatScope() {
            return chatId;
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Typing extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("user_id")
        private long userId;
        @JsonProperty("is_typing")
        private boolean typing;

        @Override
        public String chatScope() {
            return chatId;
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageList extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
        private List<MessageView> messages;
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageEditList extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("message_id")
        private String messageId;
        private List<MessageEditView> edits;
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChatDeleted extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;

        @Override
        public String chatScope() {
            return chatId;
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChatCreated extends ServerEvent {
        private ChatView chat;
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberList extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
        private List<MemberView> members;
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberUpdated extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
        private MemberView member;

        @Override
        public String chatScope() {
            return chatId;
        }
    }

    /**
     * A member left the chat. The removed user's own sessions end their subscription
     * to the chat when they see this.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberRemoved extends ServerEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("user_id")
        private long userId;

        @Override
        public String chatScope() {
            return chatId;
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pong extends ServerEvent {
        private String timestamp;
    }
}
