package com.wshg.catalog.entity;

import com.wshg.catalog.model.VectorState;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resources table. Open payloads (data, metadata, children, links) and the vector are JSON text;
 * tags live in their own table so tag filters run in SQL.
 */
@Entity
@Table(name = "resources", indexes = {
        @Index(name = "idx_resources_provider", columnList = "provider"),
        @Index(name = "idx_resources_type", columnList = "type"),
        @Index(name = "idx_resources_parent", columnList = "parent_id"),
        @Index(name = "idx_resources_created", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResourceEntity {

    @Id
    @Column(length = 255)
    private String id;

    @Column(nullable = false, length = 100)
    private String type;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(length = 64)
    private String region;

    @Column(length = 255)
    private String name;

    @Column(name = "data_json", columnDefinition = "TEXT", nullable = false)
    private String dataJson;

    @Column(name = "metadata_json", columnDefinition = "TEXT")
    private String metadataJson;

    /** Null while {@link VectorState#UNVECTORIZED}. */
    @Column(name = "embedding_json", columnDefinition = "TEXT")
    private String embeddingJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "vector_state", nullable = false, length = 16)
    private VectorState vectorState;

    @Column(name = "parent_id", length = 255)
    private String parentId;

    @Column(name = "children_json", columnDefinition = "TEXT")
    private String childrenJson;

    @Column(name = "links_json", columnDefinition = "TEXT")
    private String linksJson;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "resource_tags", joinColumns = @JoinColumn(name = "resource_id"))
    @MapKeyColumn(name = "tag_key", length = 128)
    @Column(name = "tag_value", length = 512)
    @Builder.Default
    private Map<String, String> tags = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "last_scanned_at")
    private Instant lastScannedAt;

    @Version
    private Long version;
}
