package com.aigreentick.services.evolutionapi.entity;

import com.aigreentick.services.evolutionapi.constants.InstanceStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Local copy of an Evolution API instance (one WhatsApp session)
 */
@Entity
@Table(name = "evolution_instances",
        uniqueConstraints = @UniqueConstraint(name = "uniq_evolution_instance_name",
                columnNames = {"name"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvolutionInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private InstanceStatus status = InstanceStatus.UNKNOWN;

    @Column(name = "phone_number", length = 50)
    private String phoneNumber;

    @Column(name = "profile_name")
    private String profileName;

    @Column(name = "profile_picture_url", length = 1024)
    private String profilePictureUrl;

    @Column(name = "last_seen_at")
    private LocalDateTime lastSeenAt;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public boolean isConnected() {
        return status != null && status.isConnected();
    }
}
