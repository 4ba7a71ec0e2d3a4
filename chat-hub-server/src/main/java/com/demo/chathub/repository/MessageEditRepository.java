package com.demo.chathub.repository;

import com.demo.chathub.domain.MessageEditEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Edit history of messages. Rows are removed together with their message.
 */
@Repository
public interface MessageEditRepository extends JpaRepository<MessageEditEntity, Long> {

    List<MessageEditEntity> findByMessageIdOrderByEditedAtDescIdDesc(Long messageId);

    long countByMessageId(Long messageId);

    void deleteByMessageId(Long messageId);

    void deleteByMessageIdIn(Collection<Long> messageIds);
}
