package com.compara.repository;

import com.compara.entity.ConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for stored conversations.
 */
@Repository
public interface ConversationRepository extends JpaRepository<ConversationEntity, Long> {

    Optional<ConversationEntity> findByIdAndUserId(Long id, String userId);

    /**
     * Candidate threads for a follow-up, newest first.
     */
    List<ConversationEntity> findByUserIdAndInputDataOrderByUpdatedAtDesc(String userId, String inputData);

    List<ConversationEntity> findByUserIdOrderByCreatedAtDesc(String userId);
}
