package com.demo.chathub.repository;

import com.demo.chathub.domain.MessageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MessageRepository extends JpaRepository<MessageEntity, Long> {

    Optional<MessageEntity> findByPublicIdAndChatId(String publicId, Long chatId);

    @Query("SELECT m.id FROM MessageEntity m WHERE m.publicId = :publicId AND m.chatId = :chatId")
    Optional<Long> findKeyByPublicIdAndChatId(@Param("publicId") String publicId, @Param("chatId") Long chatId);

    @Query("SELECT m.publicId FROM MessageEntity m WHERE m.id = :id")
    Optional<String> findPublicIdById(@Param("id") Long id);

    List<MessageEntity> findByChatIdOrderByCreatedAtAscIdAsc(Long chatId);

    @Query("SELECT m.id FROM MessageEntity m WHERE m.chatId = :chatId")
    List<Long> findKeysByChatId(@Param("chatId") Long chatId);

    void deleteByChatId(Long chatId);
}
