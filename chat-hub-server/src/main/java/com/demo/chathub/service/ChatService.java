package com.demo.chathub.service;

import com.demo.chathub.common.ChatHubException;
import com.demo.chathub.domain.ChatView;
import com.demo.chathub.domain.MemberRole;
import com.demo.chathub.domain.MemberView;
import com.demo.chathub.domain.ServerEvent;
import com.demo.chathub.infrastructure.BroadcastHub;
import com.demo.chathub.infrastructure.ChatStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Chat creation and membership management.
 *
 * Membership changes go to the chat channel and to the user channel of everybody who was
 * a member before the change, so a removed member still hears about its own removal.
 */
@Service
@Slf4j
public class ChatService {

    static final String INSUFFICIENT_PERMISSIONS = "Insufficient permissions";
    static final String LAST_OWNER = "Cannot remove the last owner";

    private final ChatStore chatStore;
    private final BroadcastHub broadcastHub;
    private final MetricsService metricsService;

    public ChatService(ChatStore chatStore, BroadcastHub broadcastHub, MetricsService metricsService) {
        this.chatStore = chatStore;
        this.broadcastHub = broadcastHub;
        this.metricsService = metricsService;
    }

    /**
     * Create a chat owned by {@code ownerId}. The event goes to the owner's other sessions
     * through the user channel.
     */
    public ServerEvent.ChatCreated createChat(String title, String chatType, long ownerId) {
        if (title == null || title.isBlank()) {
            throw ChatHubException.validation("Chat title is required");
        }
        ChatView chat = chatStore.insertChat(title, chatType, ownerId);
        log.info("Chat created: chatId={}, ownerId={}, type={}", chat.getId(), ownerId, chat.getChatType());

        ServerEvent.ChatCreated event = new ServerEvent.ChatCreated(chat);
        int receivers = broadcastHub.publishToUser(ownerId, event);
        metricsService.recordBroadcast("chat_created", receivers);
        return event;
    }

    public List<MemberView> listMembers(String chatId, long userId) {
        long chatKey = requireMembership(chatId, userId);
        return chatStore.listMembers(chatKey, chatId);
    }

    public ServerEvent.MemberUpdated updateMemberRole(String chatId, long actorId, Long memberUserId, String role) {
        long chatKey = requireManager(chatId, actorId);
        long target = requireTarget(memberUserId);
        MemberRole newRole = MemberRole.fromWire(role);

        if (newRole != MemberRole.OWNER && isLastOwner(chatKey, target)) {
            throw ChatHubException.validation(LAST_OWNER);
        }

        MemberView member = chatStore.updateMemberRole(chatKey, chatId, target, newRole)
                .orElseThrow(() -> ChatHubException.notFound("Member not found"));
        log.info("Member role updated: chatId={}, actorId={}, userId={}, role={}",
                chatId, actorId, target, newRole.wireName());

        ServerEvent.MemberUpdated event = ServerEvent.memberUpdated(member);
        broadcast(chatId, chatStore.fetchMemberIds(chatKey), event);
        return event;
    }

    public ServerEvent.MemberRemoved removeMember(String chatId, long actorId, Long memberUserId) {
        long chatKey = requireManager(chatId, actorId);
        long target = requireTarget(memberUserId);

        if (isLastOwner(chatKey, target)) {
            throw ChatHubException.validation(LAST_OWNER);
        }

        List<Long> formerMembers = chatStore.fetchMemberIds(chatKey);
        if (!chatStore.removeMember(chatKey, target)) {
            throw ChatHubException.notFound("Member not found");
        }
        log.info("Member removed: chatId={}, actorId={}, userId={}", chatId, actorId, target);

        ServerEvent.MemberRemoved event = ServerEvent.memberRemoved(chatId, target);
        broadcast(chatId, formerMembers, event);
        return event;
    }

    private long requireMembership(String chatId, long userId) {
        if (chatId == null || chatId.isBlank()) {
            throw ChatHubException.validation("chat_id is required");
        }
        return chatStore.checkChatMembership(chatId, userId);
    }

    private long requireManager(String chatId, long actorId) {
        long chatKey = requireMembership(chatId, actorId);
        boolean manager = chatStore.findMemberRole(chatKey, actorId)
                .map(MemberRole::canModerate)
                .orElse(false);
        if (!manager) {
            log.warn("Rejected member change: chatId={}, actorId={}", chatId, actorId);
            throw ChatHubException.forbidden(INSUFFICIENT_PERMISSIONS);
        }
        return chatKey;
    }

    private static long requireTarget(Long memberUserId) {
        if (memberUserId == null) {
            throw ChatHubException.validation("member_user_id is required");
        }
        return memberUserId;
    }

    private boolean isLastOwner(long chatKey, long userId) {
        return chatStore.findMemberRole(chatKey, userId).orElse(null) == MemberRole.OWNER
                && chatStore.countOwners(chatKey) <= 1;
    }

    private void broadcast(String chatId, List<Long> members, ServerEvent event) {
        int receivers = broadcastHub.publishToChat(chatId, event);
        receivers += broadcastHub.publishToUsers(members, event);
        metricsService.recordBroadcast(event.getClass().getSimpleName(), receivers);
    }
}
