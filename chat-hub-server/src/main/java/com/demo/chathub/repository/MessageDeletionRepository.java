package com.demo.chathub.repository;

import com.demo.chathub.domain.MessageDeletionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MessageDeletionRepository extends JpaRepository<MessageDeletionEntity, Long> {

    List<MessageDeletionEntity> findByMessageId(Long messageId);
}
