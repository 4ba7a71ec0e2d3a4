package com.demo.chathub.infrastructure;

import com.demo.chathub.domain.ServerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of chat-scoped and user-scoped broadcast channels.
 *
 * Chat channels are created on first subscribe and live until the chat is deleted.
 * User channels are reference counted: they exist while at least one connection of the
 * user holds a receiver, and publishing to a user without a channel does nothing.
 */
@Component
@Slf4j
public class BroadcastHub {

    private final ConcurrentHashMap<String, BroadcastChannel<ServerEvent>> chatChannels = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, BroadcastChannel<ServerEvent>> userChannels = new ConcurrentHashMap<>();
    private final int capacity;

    public BroadcastHub(@Value("${chat.broadcast.capacity:100}") int capacity) {
        this.capacity = capacity;
        log.info("BroadcastHub initialized: capacity={}", capacity);
    }

    public BroadcastChannel<ServerEvent> getOrCreateChatChannel(String chatId) {
        return chatChannels.computeIfAbsent(chatId, id -> {
            log.debug("Chat channel created: chatId={}", id);
            return new BroadcastChannel<>("chat:" + id, capacity);
        });
    }

    /**
     * Attach a receiver to the chat's channel, creating the channel if needed. Runs inside
     * the registry's atomic section, like {@link #subscribeUser}.
     */
    public BroadcastChannel<ServerEvent>.Receiver subscribeChat(String chatId) {
        AtomicReference<BroadcastChannel<ServerEvent>.Receiver> holder = new AtomicReference<>();
        chatChannels.compute(chatId, (id, channel) -> {
            BroadcastChannel<ServerEvent> target = channel;
            if (target == null) {
                log.debug("Chat channel created: chatId={}", id);
                target = new BroadcastChannel<>("chat:" + id, capacity);
            }
            holder.set(target.subscribe());
            return target;
        });
        return holder.get();
    }

    public BroadcastChannel<ServerEvent> getOrCreateUserChannel(long userId) {
        return userChannels.computeIfAbsent(userId, id -> new BroadcastChannel<>("user:" + id, capacity));
    }

    /**
     * Attach a receiver to the user's channel, creating the channel if needed.
     * The attach runs inside the registry's atomic section so it cannot race with
     * {@link #releaseUser} removing the channel.
     */
    public BroadcastChannel<ServerEvent>.Receiver subscribeUser(long userId) {
        AtomicReference<BroadcastChannel<ServerEvent>.Receiver> holder = new AtomicReference<>();
        userChannels.compute(userId, (id, channel) -> {
            BroadcastChannel<ServerEvent> target = channel != null
                    ? channel
                    : new BroadcastChannel<>("user:" + id, capacity);
            holder.set(target.subscribe());
            return target;
        });
        return holder.get();
    }

    /**
     * Detach a receiver obtained from {@link #subscribeUser}. The channel is dropped
     * when its last receiver goes away.
     */
    public void releaseUser(long userId, BroadcastChannel<ServerEvent>.Receiver receiver) {
        if (receiver != null) {
            receiver.close();
        }
        userChannels.computeIfPresent(userId, (id, channel) -> {
            if (channel.receiverCount() == 0) {
                log.debug("User channel released: userId={}", id);
                return null;
            }
            return channel;
        });
    }

    public int publish(BroadcastChannel<ServerEvent> channel, ServerEvent event) {
        return channel.publish(event);
    }

    /**
     * Publish to an existing chat channel. No channel means nobody is subscribed.
     */
    public int publishToChat(String chatId, ServerEvent event) {
        BroadcastChannel<ServerEvent> channel = chatChannels.get(chatId);
        return channel == null ? 0 : channel.publish(event);
    }

    public int publishToUser(long userId, ServerEvent event) {
        BroadcastChannel<ServerEvent> channel = userChannels.get(userId);
        return channel == null ? 0 : channel.publish(event);
    }

    public int publishToUsers(Collection<Long> userIds, ServerEvent event) {
        int delivered = 0;
        for (Long userId : userIds) {
            delivered += publishToUser(userId, event);
        }
        return delivered;
    }

    /**
     * Drop the registry entry. Receivers already attached keep what they buffered.
     */
    public void removeChatChannel(String chatId) {
        if (chatChannels.remove(chatId) != null) {
            log.info("Chat channel removed: chatId={}", chatId);
        }
    }

    /**
     * Drop the chat channel only if nobody is attached to it. Used to undo a channel that
     * a subscribe re-created for a chat that no longer admits the subscriber.
     *
     * @return true if the channel was removed
     */
    public boolean removeIdleChatChannel(String chatId) {
        AtomicReference<Boolean> removed = new AtomicReference<>(false);
        chatChannels.computeIfPresent(chatId, (id, channel) -> {
            if (channel.receiverCount() == 0) {
                removed.set(true);
                return null;
            }
            return channel;
        });
        if (removed.get()) {
            log.info("Idle chat channel removed: chatId={}", chatId);
        }
        return removed.get();
    }

    public boolean hasChatChannel(String chatId) {
        return chatChannels.containsKey(chatId);
    }

    public boolean hasUserChannel(long userId) {
        return userChannels.containsKey(userId);
    }

    public int chatChannelCount() {
        return chatChannels.size();
    }

    public int userChannelCount() {
        return userChannels.size();
    }
}
