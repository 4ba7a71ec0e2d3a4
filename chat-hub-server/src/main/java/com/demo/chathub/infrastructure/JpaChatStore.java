package com.demo.chathub.infrastructure;

import com.demo.chathub.common.ChatHubException;
import com.demo.chathub.domain.*;
import com.demo.chathub.repository.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * {@link ChatStore} backed by Spring Data JPA.
 */
@Slf4j
@Repository
public class JpaChatStore implements ChatStore {

    private final ChatRepository chatRepository;
    private final ChatMemberRepository memberRepository;
    private final MessageRepository messageRepository;
    private final MessageEditRepository editRepository;
    private final MessageDeletionRepository deletionRepository;
    private final UserRepository userRepository;

    public JpaChatStore(ChatRepository chatRepository,
                        ChatMemberRepository memberRepository,
                        MessageRepository messageRepository,
                        MessageEditRepository editRepository,
                        MessageDeletionRepository deletionRepository,
                        UserRepository userRepository) {
        this.chatRepository = chatRepository;
        this.memberRepository = memberRepository;
        this.messageRepository = messageRepository;
        this.editRepository = editRepository;
        this.deletionRepository = deletionRepository;
        this.userRepository = userRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public long checkChatMembership(String chatId, long userId) {
        return chatRepository.findKeyForMember(chatId, userId)
                .orElseThrow(() -> ChatHubException.forbidden("Not a member of this chat"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> fetchMemberIds(long chatKey) {
        return memberRepository.findUserIdsByChatId(chatKey);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MemberRole> findMemberRole(long chatKey, long userId) {
        return memberRepository.findByChatIdAndUserId(chatKey, userId)
                .map(ChatMemberEntity::getRole);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Long> resolveMessageKey(long chatKey, String messagePublicId) {
        if (messagePublicId == null || messagePublicId.isBlank()) {
            return Optional.empty();
        }
        return messageRepository.findKeyByPublicIdAndChatId(messagePublicId, chatKey);
    }

    @Override
    @Transactional
    public MessageView insertMessage(long chatKey, NewMessage message, Long threadKey, Long replyToKey) {
        Instant now = Instant.now();
        MessageEntity entity = MessageEntity.builder()
                .publicId(UUID.randomUUID().toString())
                .chatId(chatKey)
                .userId(message.getAuthorId())
                .content(message.getContent())
                .role(message.getRole())
                .model(message.getModel())
                .messageType(message.getMessageType() != null ? message.getMessageType() : "text")
                .threadId(threadKey)
                .replyToId(replyToKey)
                .createdAt(now)
                .updatedAt(now)
                .build();

        MessageEntity saved = messageRepository.save(entity);
        log.debug("Message stored: messageId={}, chatKey={}, role={}",
                saved.getPublicId(), chatKey, saved.getRole());
        return toView(saved, message.getChatId());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MessageView> findMessage(long chatKey, String chatId, String messagePublicId) {
        return messageRepository.findByPublicIdAndChatId(messagePublicId, chatKey)
                .map(entity -> toView(entity, chatId));
    }

    @Override
    @Transactional
    public MessageView recordEditAndUpdate(MessageView original, long editorId, String newContent) {
        MessageEntity entity = messageRepository.findById(original.getKey())
                .orElseThrow(() -> ChatHubException.notFound("Message not found"));
        Instant now = Instant.now();

        // Audit row first; it captures the content as it was before this update
        editRepository.save(MessageEditEntity.builder()
                .messageId(entity.getId())
                .editedByUserId(editorId)
                .oldContent(entity.getContent())
                .newContent(newContent)
                .editedAt(now)
                .build());
        editRepository.flush();

        entity.setContent(newContent);
        entity.setUpdatedAt(now);
        MessageEntity saved = messageRepository.saveAndFlush(entity);

        return toView(saved, original.getChatId());
    }

    @Override
    @Transactional
    public void recordDeletionAndDelete(MessageView original, long actorId, String reason) {
        MessageEntity entity = messageRepository.findById(original.getKey())
                .orElseThrow(() -> ChatHubException.notFound("Message not found"));

        deletionRepository.save(MessageDeletionEntity.builder()
                .messageId(entity.getId())
                .messagePublicId(entity.getPublicId())
                .deletedByUserId(actorId)
                .oldContent(entity.getContent())
                .reason(reason)
                .deletedAt(Instant.now())
                .build());
        deletionRepository.flush();

        editRepository.deleteByMessageId(entity.getId());
        messageRepository.delete(entity);
        messageRepository.flush();
    }

    @Override
    @Transactional(readOnly = true)
    public List<MessageView> listMessages(long chatKey, String chatId) {
        return messageRepository.findByChatIdOrderByCreatedAtAscIdAsc(chatKey).stream()
                .map(entity -> toView(entity, chatId))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<MessageEditView> listEdits(MessageView message) {
        return editRepository.findByMessageIdOrderByEditedAtDescIdDesc(message.getKey()).stream()
                .map(edit -> MessageEditView.builder()
                        .id(edit.getId())
                        .messageId(message.getId())
                        .editedByUserId(edit.getEditedByUserId())
                        .oldContent(edit.getOldContent())
                        .newContent(edit.getNewContent())
                        .editedAt(edit.getEditedAt())
                        .build())
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public ChatView insertChat(String title, String chatType, long ownerId) {
        ChatEntity chat = chatRepository.save(ChatEntity.builder()
                .publicId(UUID.randomUUID().toString())
                .title(title)
                .chatType(chatType)
                .createdBy(ownerId)
                .build());
        memberRepository.save(ChatMemberEntity.builder()
                .chatId(chat.getId())
                .userId(ownerId)
                .role(MemberRole.OWNER)
                .build());

        log.debug("Chat stored: chatId={}, chatKey={}, ownerId={}", chat.getPublicId(), chat.getId(), ownerId);
        return ChatView.builder()
                .id(chat.getPublicId())
                .title(chat.getTitle())
                .chatType(chat.getChatType())
                .createdBy(chat.getCreatedBy())
                .createdAt(chat.getCreatedAt())
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<MemberView> listMembers(long chatKey, String chatId) {
        return memberRepository.findByChatIdOrderByJoinedAtAscIdAsc(chatKey).stream()
                .map(member -> toView(member, chatId))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public long countOwners(long chatKey) {
        return memberRepository.countByChatIdAndRole(chatKey, MemberRole.OWNER);
    }

    @Override
    @Transactional
    public Optional<MemberView> updateMemberRole(long chatKey, String chatId, long userId, MemberRole role) {
        return memberRepository.findByChatIdAndUserId(chatKey, userId)
                .map(member -> {
                    member.setRole(role);
                    return toView(memberRepository.saveAndFlush(member), chatId);
                });
    }

    @Override
    @Transactional
    public boolean removeMember(long chatKey, long userId) {
        return memberRepository.deleteByChatIdAndUserId(chatKey, userId) > 0;
    }

    @Override
    @Transactional
    public List<Long> deleteChat(long chatKey) {
        List<Long> memberIds = memberRepository.findUserIdsByChatId(chatKey);
        List<Long> messageKeys = messageRepository.findKeysByChatId(chatKey);

        if (!messageKeys.isEmpty()) {
            editRepository.deleteByMessageIdIn(messageKeys);
        }
        messageRepository.deleteByChatId(chatKey);
        memberRepository.deleteByChatId(chatKey);
        chatRepository.deleteById(chatKey);

        log.info("Chat deleted: chatKey={}, members={}, messages={}",
                chatKey, memberIds.size(), messageKeys.size());
        return memberIds;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AuthenticatedUser> findUser(long userId) {
        return userRepository.findById(userId)
                .map(user -> AuthenticatedUser.builder()
                        .id(user.getId())
                        .publicId(user.getPublicId())
                        .email(user.getEmail())
                        .displayName(user.getDisplayName())
                        .build());
    }

    private MessageView toView(MessageEntity entity, String chatId) {
        return MessageView.builder()
                .key(entity.getId())
                .id(entity.getPublicId())
                .chatId(chatId)
                .userId(entity.getUserId())
                .content(entity.getContent())
                .role(entity.getRole())
                .model(entity.getModel())
                .messageType(entity.getMessageType())
                .threadId(publicIdOf(entity.getThreadId()))
                .replyToId(publicIdOf(entity.getReplyToId()))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private MemberView toView(ChatMemberEntity member, String chatId) {
        return MemberView.builder()
                .chatId(chatId)
                .userId(member.getUserId())
                .role(member.getRole())
                .joinedAt(member.getJoinedAt())
                .build();
    }

    private String publicIdOf(Long messageKey) {
        if (messageKey == null) {
            return null;
        }
        return messageRepository.findPublicIdById(messageKey).orElse(null);
    }
}
