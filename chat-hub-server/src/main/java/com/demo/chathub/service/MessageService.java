package com.demo.chathub.service;

import com.demo.chathub.common.ChatHubException;
import com.demo.chathub.domain.MemberRole;
import com.demo.chathub.domain.MessageEditView;
import com.demo.chathub.domain.MessageView;
import com.demo.chathub.domain.NewMessage;
import com.demo.chathub.domain.ServerEvent;
import com.demo.chathub.infrastructure.BroadcastHub;
import com.demo.chathub.infrastructure.ChatStore;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Message pipeline: authorize, persist with audit, then broadcast.
 *
 * Every mutating operation returns the event it broadcast so the caller can hand the
 * same event (same event id) straight to the originating connection.
 * Nothing is broadcast unless the store call returned normally.
 */
@Service
@Slf4j
public class MessageService {

    static final String DELETION_REASON = "User deleted message";

    private final ChatStore chatStore;
    private final BroadcastHub broadcastHub;
    private final MetricsService metricsService;

    @Autowired(required = false)
    private EventPublisher eventPublisher;

    public MessageService(ChatStore chatStore, BroadcastHub broadcastHub, MetricsService metricsService) {
        this.chatStore = chatStore;
        this.broadcastHub = broadcastHub;
        this.metricsService = metricsService;
    }

    void setEventPublisher(EventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    /**
     * @return internal chat key
     */
    public long requireMembership(String chatId, long userId) {
        if (chatId == null || chatId.isBlank()) {
            throw ChatHubException.validation("chat_id is required");
        }
        return chatStore.checkChatMembership(chatId, userId);
    }

    public Posted create(NewMessage message) {
        long chatKey = requireMembership(message.getChatId(), message.getAuthorId());
        if (message.getRole() == null) {
            throw ChatHubException.validation("Invalid role");
        }
        if (message.getContent() == null) {
            throw ChatHubException.validation("Message content is required");
        }

        Long threadKey = resolveReference(chatKey, message.getThreadId(), "thread");
        Long replyToKey = resolveReference(chatKey, message.getReplyToId(), "reply_to");

        MessageView stored = chatStore.insertMessage(chatKey, message, threadKey, replyToKey);
        log.info("Message created: chatId={}, messageId={}, userId={}, role={}, model={}",
                stored.getChatId(), stored.getId(), stored.getUserId(), stored.getRole().wireName(), stored.getModel());

        ServerEvent.MessagePosted event = ServerEvent.messagePosted(stored);
        broadcast(chatKey, stored.getChatId(), event);

        if (eventPublisher != null) {
            eventPublisher.publishMessageCreated(stored);
        }
        return new Posted(stored, event);
    }

    public Updated update(String chatId, String messageId, long editorId, String newContent) {
        long chatKey = requireMembership(chatId, editorId);
        if (newContent == null) {
            throw ChatHubException.validation("Message content is required");
        }
        MessageView original = findOwnedOrModerated(chatKey, chatId, messageId, editorId, "edit");

        MessageView updated = chatStore.recordEditAndUpdate(original, editorId, newContent);
        log.info("Message updated: chatId={}, messageId={}, editorId={}", chatId, messageId, editorId);

        ServerEvent.MessageUpdated event = ServerEvent.messageUpdated(updated);
        broadcast(chatKey, chatId, event);

        if (eventPublisher != null) {
            eventPublisher.publishMessageUpdated(updated, editorId);
        }
        return new Updated(updated, event);
    }

    public ServerEvent.MessageDeleted delete(String chatId, String messageId, long actorId) {
        long chatKey = requireMembership(chatId, actorId);
        MessageView original = findOwnedOrModerated(chatKey, chatId, messageId, actorId, "delete");

        chatStore.recordDeletionAndDelete(original, actorId, DELETION_REASON);
        log.info("Message deleted: chatId={}, messageId={}, actorId={}", chatId, messageId, actorId);

        ServerEvent.MessageDeleted event = ServerEvent.messageDeleted(chatId, original.getId());
        broadcast(chatKey, chatId, event);

        if (eventPublisher != null) {
            eventPublisher.publishMessageDeleted(chatId, original.getId(), actorId);
        }
        return event;
    }

    public List<MessageView> listMessages(String chatId, long userId) {
        long chatKey = requireMembership(chatId, userId);
        return chatStore.listMessages(chatKey, chatId);
    }

    /**
     * Edit history of one message, newest first.
     */
    public List<MessageEditView> listMessageEdits(String chatId, String messageId, long userId) {
        long chatKey = requireMembership(chatId, userId);
        MessageView message = chatStore.findMessage(chatKey, chatId, messageId)
                .orElseThrow(() -> ChatHubException.notFound("Message not found"));
        return chatStore.listEdits(message);
    }

    /**
     * Delete a whole chat. Owner only. Former members are told through their user
     * channels, current subscribers through the chat channel, which is then dropped.
     */
    public ServerEvent.ChatDeleted deleteChat(String chatId, long actorId) {
        long chatKey = requireMembership(chatId, actorId);
        MemberRole role = chatStore.findMemberRole(chatKey, actorId)
                .orElseThrow(() -> ChatHubException.forbidden("Not a member of this chat"));
        if (role != MemberRole.OWNER) {
            throw ChatHubException.forbidden("Only the chat owner can delete the chat");
        }

        List<Long> formerMembers = chatStore.deleteChat(chatKey);
        log.info("Chat deleted: chatId={}, actorId={}, members={}", chatId, actorId, formerMembers.size());

        ServerEvent.ChatDeleted event = ServerEvent.chatDeleted(chatId);
        int receivers = broadcastHub.publishToChat(chatId, event);
        receivers += broadcastHub.publishToUsers(formerMembers, event);
        broadcastHub.removeChatChannel(chatId);
        metricsService.recordBroadcast("chat_deleted", receivers);
        return event;
    }

    private MessageView findOwnedOrModerated(long chatKey, String chatId, String messageId,
                                             long userId, String action) {
        if (messageId == null || messageId.isBlank()) {
            throw ChatHubException.validation("message_id is required");
        }
        MessageView message = chatStore.findMessage(chatKey, chatId, messageId)
                .orElseThrow(() -> ChatHubException.notFound("Message not found"));

        if (message.getUserId() == userId) {
            return message;
        }
        boolean moderator = chatStore.findMemberRole(chatKey, userId)
                .map(MemberRole::canModerate)
                .orElse(false);
        if (!moderator) {
            log.warn("Rejected {}: chatId={}, messageId={}, userId={}, authorId={}",
                    action, chatId, messageId, userId, message.getUserId());
            throw ChatHubException.forbidden("Not allowed to " + action + " this message");
        }
        return message;
    }

    private Long resolveReference(long chatKey, String publicId, String kind) {
        if (publicId == null || publicId.isBlank()) {
            return null;
        }
        Optional<Long> key = chatStore.resolveMessageKey(chatKey, publicId);
        if (key.isEmpty()) {
            // Unknown references are dropped, the message is still created
            log.debug("Unresolved {} reference ignored: chatKey={}, messageId={}", kind, chatKey, publicId);
        }
        return key.orElse(null);
    }

    /**
     * Chat channel for live subscribers, user channels so members see it while not subscribed.
     */
    private void broadcast(long chatKey, String chatId, ServerEvent event) {
        int receivers = broadcastHub.publishToChat(chatId, event);
        List<Long> members = chatStore.fetchMemberIds(chatKey);
        receivers += broadcastHub.publishToUsers(members, event);
        metricsService.recordBroadcast(event.getClass().getSimpleName(), receivers);
    }

    @Value
    public static class Posted {
        MessageView message;
        ServerEvent.MessagePosted event;
    }

    @Value
    public static class Updated {
        MessageView message;
        ServerEvent.MessageUpdated event;
    }
}
