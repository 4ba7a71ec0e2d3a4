package com.demo.chathub.service;

import com.demo.chathub.common.ChatHubException;
import com.demo.chathub.common.ErrorKind;
import com.demo.chathub.domain.ClientEvent;
import com.demo.chathub.domain.MessageRole;
import com.demo.chathub.domain.NewMessage;
import com.demo.chathub.domain.ServerEvent;
import com.demo.chathub.infrastructure.BroadcastHub;
import com.demo.chathub.infrastructure.ConnectionSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Decodes inbound frames and runs the matching operation for one connection.
 *
 * Frames of a connection are handled one at a time on the thread that delivered them.
 * Every failure ends up as an {@code error} frame for that connection only; the
 * connection stays open.
 */
@Service
@Slf4j
public class ClientEventDispatcher {

    static final String NOT_SUBSCRIBED = "Not subscribed to chat";

    private final ObjectMapper objectMapper;
    private final MessageService messageService;
    private final ChatService chatService;
    private final CompletionFanOut completionFanOut;
    private final BroadcastHub broadcastHub;
    private final MetricsService metricsService;

    public ClientEventDispatcher(ObjectMapper objectMapper,
                                 MessageService messageService,
                                 ChatService chatService,
                                 CompletionFanOut completionFanOut,
                                 BroadcastHub broadcastHub,
                                 MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.messageService = messageService;
        this.chatService = chatService;
        this.completionFanOut = completionFanOut;
        this.broadcastHub = broadcastHub;
        this.metricsService = metricsService;
    }

    public void handleFrame(ConnectionSession session, String payload) {
        ClientEvent event;
        try {
            event = objectMapper.readValue(payload, ClientEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Invalid event format: sessionId={}, error={}", session.getSessionId(), e.getOriginalMessage());
            session.enqueue(ServerEvent.error(ErrorKind.VALIDATION_FAILED.message()));
            return;
        }
        if (event == null) {
            session.enqueue(ServerEvent.error(ErrorKind.VALIDATION_FAILED.message()));
            return;
        }
        dispatch(session, event);
    }

    public void dispatch(ConnectionSession session, ClientEvent event) {
        metricsService.recordEventReceived(event.typeName());
        log.debug("Event received: sessionId={}, userId={}, type={}",
                session.getSessionId(), session.userId(), event.typeName());

        try {
            route(session, event);
        } catch (ChatHubException e) {
            log.warn("Event rejected: sessionId={}, userId={}, type={}, code={}, error={}",
                    session.getSessionId(), session.userId(), event.typeName(), e.getCode(), e.getMessage());
            session.enqueue(ServerEvent.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Failed to process event: sessionId={}, userId={}, type={}",
                    session.getSessionId(), session.userId(), event.typeName(), e);
            metricsService.recordError("EVENT_PROCESSING_ERROR", "ClientEventDispatcher");
            session.enqueue(ServerEvent.error(ErrorKind.INTERNAL.message()));
        }
    }

    private void route(ConnectionSession session, ClientEvent event) {
        long userId = session.userId();

        if (event instanceof ClientEvent.Subscribe subscribe) {
            handleSubscribe(session, subscribe.getChatId());

        } else if (event instanceof ClientEvent.Unsubscribe unsubscribe) {
            requireChatId(unsubscribe.getChatId());
            session.unsubscribe(unsubscribe.getChatId());
            session.enqueue(ServerEvent.unsubscribed(unsubscribe.getChatId()));

        } else if (event instanceof ClientEvent.SendMessage send) {
            MessageService.Posted posted = messageService.create(NewMessage.builder()
                    .chatId(send.getChatId())
                    .authorId(userId)
                    .content(send.getContent())
                    .role(MessageRole.USER)
                    .build());
            // Sender sees its own message before any fan-out error
            session.enqueue(posted.getEvent());
            completionFanOut.dispatch(posted.getMessage(), send.getModels(), session);

        } else if (event instanceof ClientEvent.CreateMessage create) {
            MessageService.Posted posted = messageService.create(NewMessage.builder()
                    .chatId(create.getChatId())
                    .authorId(userId)
                    .content(create.getContent())
                    .role(MessageRole.fromWire(create.getRole()))
                    .model(create.getModel())
                    .messageType(create.getMessageType())
                    .threadId(create.getThreadId())
                    .replyToId(create.getReplyToId())
                    .build());
            session.enqueue(posted.getEvent());

        } else if (event instanceof ClientEvent.UpdateMessage update) {
            MessageService.Updated updated = messageService.update(
                    update.getChatId(), update.getMessageId(), userId, update.getContent());
            session.enqueue(updated.getEvent());

        } else if (event instanceof ClientEvent.DeleteMessage delete) {
            session.enqueue(messageService.delete(delete.getChatId(), delete.getMessageId(), userId));

        } else if (event instanceof ClientEvent.Typing typing) {
            handleTyping(session, typing);

        } else if (event instanceof ClientEvent.GetMessages get) {
            session.enqueue(new ServerEvent.MessageList(
                    get.getChatId(), messageService.listMessages(get.getChatId(), userId)));

        } else if (event instanceof ClientEvent.GetMessageEdits edits) {
            session.enqueue(new ServerEvent.MessageEditList(
                    edits.getChatId(), edits.getMessageId(),
                    messageService.listMessageEdits(edits.getChatId(), edits.getMessageId(), userId)));

        } else if (event instanceof ClientEvent.CreateChat createChat) {
            session.enqueue(chatService.createChat(createChat.getTitle(), createChat.getChatType(), userId));

        } else if (event instanceof ClientEvent.DeleteChat deleteChat) {
            session.enqueue(messageService.deleteChat(deleteChat.getChatId(), userId));

        } else if (event instanceof ClientEvent.ListMembers list) {
            session.enqueue(new ServerEvent.MemberList(
                    list.getChatId(), chatService.listMembers(list.getChatId(), userId)));

        } else if (event instanceof ClientEvent.UpdateMemberRole update) {
            session.enqueue(chatService.updateMemberRole(
                    update.getChatId(), userId, update.getMemberUserId(), update.getRole()));

        } else if (event instanceof ClientEvent.RemoveMember remove) {
            session.enqueue(chatService.removeMember(remove.getChatId(), userId, remove.getMemberUserId()));

        } else if (event instanceof ClientEvent.Ping) {
            session.enqueue(new ServerEvent.Pong(Instant.now().toString()));

        } else {
            throw ChatHubException.validation(ErrorKind.VALIDATION_FAILED.message());
        }
    }

    /**
     * Membership is checked again once the receiver is attached. A chat deleted (or a
     * member removed) in between would otherwise leave a live relay, and a channel
     * re-created for a chat that no longer exists.
     */
    private void handleSubscribe(ConnectionSession session, String chatId) {
        long chatKey = messageService.requireMembership(chatId, session.userId());
        if (!session.subscribe(chatId, chatKey, broadcastHub.subscribeChat(chatId))) {
            broadcastHub.removeIdleChatChannel(chatId);
            return;
        }
        try {
            messageService.requireMembership(chatId, session.userId());
        } catch (ChatHubException e) {
            session.unsubscribe(chatId);
            broadcastHub.removeIdleChatChannel(chatId);
            throw e;
        }
        session.enqueue(ServerEvent.subscribed(chatId));
    }

    private void handleTyping(ConnectionSession session, ClientEvent.Typing typing) {
        requireChatId(typing.getChatId());
        if (!session.isSubscribed(typing.getChatId())) {
            throw ChatHubException.validation(NOT_SUBSCRIBED);
        }
        broadcastHub.publishToChat(typing.getChatId(),
                ServerEvent.typing(typing.getChatId(), session.userId(), typing.isTyping()));
    }

    private static void requireChatId(String chatId) {
        if (chatId == null || chatId.isBlank()) {
            throw ChatHubException.validation("chat_id is required");
        }
    }
}
