package com.aigreentick.services.evolutionapi.entity;

import com.aigreentick.services.evolutionapi.constants.MessageStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Log of an outbound message accepted by the Evolution API.
 * Delivery and read acks from messages.update move the status forward.
 */
@Entity
@Table(name = "evolution_messages",
        indexes = {
                @Index(name = "idx_evolution_messages_message_id", columnList = "message_id"),
                @Index(name = "idx_evolution_messages_created_at", columnList = "created_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvolutionMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "message_id", length = 100)
    private String messageId;

    @Column(name = "instance_name", nullable = false, length = 100)
    private String instanceName;

    @Column(name = "remote_jid", length = 100)
    private String remoteJid;

    @Column(name = "message_type", nullable = false, length = 20)
    private String messageType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MessageStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "content", columnDefinition = "TEXT")
    private Map<String, Object> content;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "response", columnDefinition = "TEXT")
    private Map<String, Object> response;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    /**
     * Acks can arrive out of order; never move a READ message back to DELIVERED.
     */
    public void advanceStatus(MessageStatus next) {
        if (status == null || next.ordinal() > status.ordinal()) {
            this.status = next;
        }
    }
}
