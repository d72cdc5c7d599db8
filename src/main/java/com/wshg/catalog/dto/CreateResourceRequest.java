package com.wshg.catalog.dto;

import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.ResourceLink;
import com.wshg.catalog.model.ResourceMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Input of CreateResource. {@code id} is optional; one is generated when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateResourceRequest {

    private String id;
    private String type;
    private String provider;
    private String region;
    private String name;
    private Map<String, Object> data;
    private Map<String, String> tags;
    private ResourceMetadata metadata;
    private String parentId;
    private Set<String> children;
    private List<ResourceLink> links;
    private Instant lastScannedAt;

    public Resource toResource() {
        return Resource.builder()
                .id(id)
                .type(type)
                .provider(provider)
                .region(region)
                .name(name)
                .data(data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>())
                .tags(tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>())
                .metadata(metadata != null ? metadata.copy() : new ResourceMetadata())
                .parentId(parentId != null && !parentId.isBlank() ? parentId : null)
                .children(children != null ? new TreeSet<>(children) : new TreeSet<>())
                .links(links != null ? new ArrayList<>(links) : new ArrayList<>())
                .lastScannedAt(lastScannedAt)
                .build();
    }
}
