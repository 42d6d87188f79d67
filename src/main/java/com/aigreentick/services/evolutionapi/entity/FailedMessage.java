package com.aigreentick.services.evolutionapi.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * A message whose send job was exhausted (or failed for good).
 *
 * Lifecycle:
 *   created  : terminal MessageFailedEvent
 *   updated  : each failed `retry` run (retryCount + 1, lastError)
 *   deleted  : successful `retry`, or `prune` by age
 */
@Entity
@Table(name = "evolution_failed_messages",
        indexes = @Index(name = "idx_evolution_failed_messages_created_at", columnList = "created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FailedMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instance_name", nullable = false, length = 100)
    private String instanceName;

    @Column(name = "recipient", length = 100)
    private String recipient;

    @Column(name = "message_type", nullable = false, length = 20)
    private String messageType;

    @Column(name = "connection_name", length = 100)
    private String connectionName;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "payload", columnDefinition = "TEXT", nullable = false)
    private Map<String, Object> payload;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public void recordRetryFailure(String error) {
        this.retryCount++;
        this.lastError = error;
    }
}
