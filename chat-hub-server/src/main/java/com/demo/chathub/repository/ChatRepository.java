package com.demo.chathub.repository;

import com.demo.chathub.domain.ChatEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChatRepository extends JpaRepository<ChatEntity, Long> {

    Optional<ChatEntity> findByPublicId(String publicId);

    /**
     * Resolve a public chat id to its internal key, only if the user is a member.
     */
    @Query("SELECT c.id FROM ChatEntity c, ChatMemberEntity m " +
           "WHERE c.publicId = :chatId " +
           "AND m.chatId = c.id " +
           "AND m.userId = :userId")
    Optional<Long> findKeyForMember(@Param("chatId") String chatId, @Param("userId") long userId);
}
