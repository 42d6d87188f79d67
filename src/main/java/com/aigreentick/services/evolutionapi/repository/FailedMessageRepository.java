package com.aigreentick.services.evolutionapi.repository;

import com.aigreentick.services.evolutionapi.entity.FailedMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Failed-message records, shared by the terminal failure listener and the
 * `retry` / `prune` commands. Concurrent access relies on the database's
 * row-level transaction semantics.
 */
@Repository
public interface FailedMessageRepository extends JpaRepository<FailedMessage, Long> {

    /**
     * Records still eligible for `retry`, oldest first.
     * {@code instanceName} null means every instance.
     */
    @Query("""
            SELECT f FROM FailedMessage f
            WHERE f.retryCount < :maxRetries
            AND (:instanceName IS NULL OR f.instanceName = :instanceName)
            ORDER BY f.createdAt ASC, f.id ASC
            """)
    List<FailedMessage> findRetryable(@Param("instanceName") String instanceName,
                                      @Param("maxRetries") int maxRetries,
                                      Pageable pageable);

    long countByCreatedAtBefore(LocalDateTime cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FailedMessage f WHERE f.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
