package com.demo.chathub.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Client → server frames, one JSON object per frame tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClientEvent.Subscribe.class, name = "subscribe"),
        @JsonSubTypes.Type(value = ClientEvent.Unsubscribe.class, name = "unsubscribe"),
        @JsonSubTypes.Type(value = ClientEvent.SendMessage.class, names = {"send_message", "message"}),
        @JsonSubTypes.Type(value = ClientEvent.CreateMessage.class, name = "create_message"),
        @JsonSubTypes.Type(value = ClientEvent.UpdateMessage.class, name = "update_message"),
        @JsonSubTypes.Type(value = ClientEvent.DeleteMessage.class, name = "delete_message"),
        @JsonSubTypes.Type(value = ClientEvent.Typing.class, name = "typing"),
        @JsonSubTypes.Type(value = ClientEvent.GetMessages.class, name = "get_messages"),
        @JsonSubTypes.Type(value = ClientEvent.GetMessageEdits.class, name = "get_message_edits"),
        @JsonSubTypes.Type(value = ClientEvent.CreateChat.class, name = "create_chat"),
        @JsonSubTypes.Type(value = ClientEvent.DeleteChat.class, name = "delete_chat"),
        @JsonSubTypes.Type(value = ClientEvent.ListMembers.class, name = "list_members"),
        @JsonSubTypes.Type(value = ClientEvent.UpdateMemberRole.class, name = "update_member_role"),
        @JsonSubTypes.Type(value = ClientEvent.RemoveMember.class, name = "remove_member"),
        @JsonSubTypes.Type(value = ClientEvent.Ping.class, name = "ping")
})
public abstract class ClientEvent {

    /**
     * Short name used in logs and metrics.
     */
    public abstract String typeName();

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Subscribe extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;

        @Override
        public String typeName() {
            return "subscribe";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Unsubscribe extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;

        @Override
        public String typeName() {
            return "unsubscribe";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendMessage extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;
        private String content;
        // Accepts either a list of model names or a single name
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        private List<String> models = new ArrayList<>();

        @Override
        public String typeName() {
            return "send_message";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateMessage extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;
        private String content;
        private String role;
        private String model;
        @JsonProperty("message_type")
        private String messageType;
        @JsonProperty("thread_id")
        private String threadId;
        @JsonProperty("reply_to_id")
        private String replyToId;

        @Override
        public String typeName() {
            return "create_message";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateMessage extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("message_id")
        private String messageId;
        private String content;

        @Override
        public String typeName() {
            return "update_message";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeleteMessage extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("message_id")
        private String messageId;

        @Override
        public String typeName() {
            return "delete_message";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Typing extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("is_typing")
        private boolean typing;

        @Override
        public String typeName() {
            return "typing";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GetMessages extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;

        @Override
        public String typeName() {
            return "get_messages";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GetMessageEdits extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("message_id")
        private String messageId;

        @Override
        public String typeName() {
            return "get_message_edits";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateChat extends ClientEvent {
        private String title;
        @JsonProperty("chat_type")
        private String chatType;

        @Override
        public String typeName() {
            return "create_chat";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeleteChat extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;

        @Override
        public String typeName() {
            return "delete_chat";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ListMembers extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;

        @Override
        public String typeName() {
            return "list_members";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateMemberRole extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("member_user_id")
        private Long memberUserId;
        private String role;

        @Override
        public String typeName() {
            return "update_member_role";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RemoveMember extends ClientEvent {
        @JsonProperty("chat_id")
        private String chatId;
        @JsonProperty("member_user_id")
        private Long memberUserId;

        @Override
        public String typeName() {
            return "remove_member";
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    public static class Ping extends ClientEvent {

        @Override
        public String typeName() {
            return "ping";
        }
    }
}
