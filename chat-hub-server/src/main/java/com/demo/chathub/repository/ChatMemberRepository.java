package com.demo.chathub.repository;

import com.demo.chathub.domain.ChatMemberEntity;
import com.demo.chathub.domain.MemberRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChatMemberRepository extends JpaRepository<ChatMemberEntity, Long> {

    Optional<ChatMemberEntity> findByChatIdAndUserId(Long chatId, Long userId);

    @Query("SELECT m.userId FROM ChatMemberEntity m WHERE m.chatId = :chatId ORDER BY m.userId")
    List<Long> findUserIdsByChatId(@Param("chatId") Long chatId);

    List<ChatMemberEntity> findByChatIdOrderByJoinedAtAscIdAsc(Long chatId);

    long countByChatIdAndRole(Long chatId, MemberRole role);

    long deleteByChatIdAndUserId(Long chatId, Long userId);

    void deleteByChatId(Long chatId);
}
