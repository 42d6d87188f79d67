package com.aigreentick.services.evolutionapi.repository;

import com.aigreentick.services.evolutionapi.entity.EvolutionMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface EvolutionMessageRepository extends JpaRepository<EvolutionMessage, Long> {

    Optional<EvolutionMessage> findFirstByMessageId(String messageId);

    long countByCreatedAtBefore(LocalDateTime cutoff);

    /** Bulk delete for `prune`; avoids loading rows into the persistence context */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM EvolutionMessage m WHERE m.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
