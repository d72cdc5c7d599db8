package com.wshg.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Expected shape of {@code data} for a (provider, type) pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceSchema {

    private String provider;
    private String type;
    private String version;
    /** Keys that must be present in a resource's data. */
    @Builder.Default
    private List<String> requiredFields = new ArrayList<>();
    private Map<String, Object> properties;
    private String description;
    private Instant createdAt;
    private Instant updatedAt;
}
