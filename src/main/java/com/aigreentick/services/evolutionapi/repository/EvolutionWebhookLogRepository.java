package com.aigreentick.services.evolutionapi.repository;

import com.aigreentick.services.evolutionapi.entity.EvolutionWebhookLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface EvolutionWebhookLogRepository extends JpaRepository<EvolutionWebhookLog, Long> {

    long countByCreatedAtBefore(LocalDateTime cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM EvolutionWebhookLog w WHERE w.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
