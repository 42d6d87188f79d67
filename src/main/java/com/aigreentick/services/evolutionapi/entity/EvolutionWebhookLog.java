package com.aigreentick.services.evolutionapi.entity;

import com.aigreentick.services.evolutionapi.constants.WebhookLogStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One processed webhook, kept when evolution-api.database.store-webhooks is on
 */
@Entity
@Table(name = "evolution_webhook_logs",
        indexes = @Index(name = "idx_evolution_webhook_logs_created_at", columnList = "created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvolutionWebhookLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "instance_name", length = 100)
    private String instanceName;

    @Column(name = "event", nullable = false, length = 50)
    private String event;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "payload", columnDefinition = "TEXT")
    private Map<String, Object> payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private WebhookLogStatus status;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;
}
