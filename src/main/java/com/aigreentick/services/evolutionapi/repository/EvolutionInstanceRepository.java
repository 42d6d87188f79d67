package com.aigreentick.services.evolutionapi.repository;

import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import com.aigreentick.services.evolutionapi.entity.EvolutionInstance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface EvolutionInstanceRepository extends JpaRepository<EvolutionInstance, Long> {

    Optional<EvolutionInstance> findByName(String name);

    /**
     * Targeted status update used by connection.update webhooks.
     * Returns 0 when the instance is not stored yet.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EvolutionInstance i " +
            "SET i.status = :status, i.lastSeenAt = :seenAt " +
            "WHERE i.name = :name")
    int updateStatus(@Param("name") String name,
                     @Param("status") InstanceStatus status,
                     @Param("seenAt") LocalDateTime seenAt);
}
