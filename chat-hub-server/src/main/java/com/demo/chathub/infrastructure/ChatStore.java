package com.demo.chathub.infrastructure;

import com.demo.chathub.domain.AuthenticatedUser;
import com.demo.chathub.domain.ChatView;
import com.demo.chathub.domain.MemberRole;
import com.demo.chathub.domain.MemberView;
import com.demo.chathub.domain.MessageEditView;
import com.demo.chathub.domain.MessageView;
import com.demo.chathub.domain.NewMessage;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of users, chats, memberships and messages.
 *
 * Chats are addressed by their public id at the edges and by the internal key returned
 * from {@link #checkChatMembership(String, long)} everywhere else.
 */
public interface ChatStore {

    /**
     * @return internal chat key
     * @throws com.demo.chathub.common.ChatHubException FORBIDDEN if the chat does not exist
     *         or the user is not a member
     */
    long checkChatMembership(String chatId, long userId);

    List<Long> fetchMemberIds(long chatKey);

    Optional<MemberRole> findMemberRole(long chatKey, long userId);

    /**
     * Resolve a message public id inside one chat. Empty when the id is unknown.
     */
    Optional<Long> resolveMessageKey(long chatKey, String messagePublicId);

    MessageView insertMessage(long chatKey, NewMessage message, Long threadKey, Long replyToKey);

    Optional<MessageView> findMessage(long chatKey, String chatId, String messagePublicId);

    /**
     * Write the edit audit record, then update the message content. Both happen in one
     * transaction; the returned view reflects the new content.
     */
    MessageView recordEditAndUpdate(MessageView original, long editorId, String newContent);

    /**
     * Write the deletion audit record, then delete the message and its edit history.
     */
    void recordDeletionAndDelete(MessageView original, long actorId, String reason);

    List<MessageView> listMessages(long chatKey, String chatId);

    List<MessageEditView> listEdits(MessageView message);

    /**
     * Create a chat whose only member is {@code ownerId}, as owner.
     */
    ChatView insertChat(String title, String chatType, long ownerId);

    /**
     * Members in join order.
     */
    List<MemberView> listMembers(long chatKey, String chatId);

    long countOwners(long chatKey);

    /**
     * @return the updated member, empty if the user is not a member
     */
    Optional<MemberView> updateMemberRole(long chatKey, String chatId, long userId, MemberRole role);

    /**
     * @return false if the user was not a member
     */
    boolean removeMember(long chatKey, long userId);

    /**
     * Delete the chat with its members and messages.
     *
     * @return ids of the users that were members before deletion
     */
    List<Long> deleteChat(long chatKey);

    Optional<AuthenticatedUser> findUser(long userId);
}
