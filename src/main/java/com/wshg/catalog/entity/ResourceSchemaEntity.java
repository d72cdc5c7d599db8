package com.wshg.catalog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Registered schema per (provider, type).
 */
@Entity
@Table(name = "resource_schemas", uniqueConstraints =
        @UniqueConstraint(name = "uk_resource_schemas_provider_type", columnNames = {"provider", "type"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResourceSchemaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(nullable = false, length = 100)
    private String type;

    @Column(length = 32)
    private String version;

    /** JSON array of data keys every resource of this type must carry. */
    @Column(name = "required_json", columnDefinition = "TEXT")
    private String requiredJson;

    @Column(name = "properties_json", columnDefinition = "TEXT")
    private String propertiesJson;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }
}
