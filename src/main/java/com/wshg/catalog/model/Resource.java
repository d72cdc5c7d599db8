package com.wshg.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * A catalogued cloud object. The vector is internal to similarity ranking and never serialized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Resource {

    private String id;
    private String type;
    private String provider;
    private String region;
    private String name;

    /** Provider-native payload, schema-less. */
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> tags = new LinkedHashMap<>();
    @Builder.Default
    private ResourceMetadata metadata = new ResourceMetadata();

    @JsonIgnore
    private float[] vector;
    private VectorState vectorState;

    /** Weak references: relation only, never ownership. */
    private String parentId;
    @Builder.Default
    private TreeSet<String> children = new TreeSet<>();
    @Builder.Default
    private List<ResourceLink> links = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastScannedAt;

    @JsonIgnore
    public boolean isVectorized() {
        return vector != null && vector.length > 0;
    }

    @JsonIgnore
    public boolean hasParent() {
        return parentId != null && !parentId.isBlank();
    }

    /**
     * Copy that shares no mutable collections with this instance.
     */
    public Resource copy() {
        return toBuilder()
                .data(data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>())
                .tags(tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>())
                .metadata(metadata != null ? metadata.copy() : new ResourceMetadata())
                .vector(vector != null ? vector.clone() : null)
                .children(children != null ? new TreeSet<>(children) : new TreeSet<>())
                .links(links != null ? new ArrayList<>(links) : new ArrayList<>())
                .build();
    }
}
