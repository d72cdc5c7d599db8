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
 * Patch for UpdateResource. Null fields are left untouched; {@code data} entries are merged
 * key by key and a null value removes the key. {@code id}, {@code type} and {@code provider}
 * cannot be patched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateResourceRequest {

    private String name;
    private String region;
    private Map<String, Object> data;
    /** Replaces the tag map as a whole. */
    private Map<String, String> tags;
    /** Replaces environment/costCenter/iam/custom; created/modified-by are maintained by the catalog. */
    private ResourceMetadata metadata;
    /** Blank clears the parent. */
    private String parentId;
    private Set<String> children;
    private List<ResourceLink> links;
    private Instant lastScannedAt;

    public void applyTo(Resource resource) {
        if (name != null) resource.setName(name);
        if (region != null) resource.setRegion(region);
        if (data != null) {
            Map<String, Object> merged = new LinkedHashMap<>(resource.getData());
            data.forEach((k, v) -> {
                if (v == null) merged.remove(k);
                else merged.put(k, v);
            });
            resource.setData(merged);
        }
        if (tags != null) resource.setTags(new LinkedHashMap<>(tags));
        if (metadata != null) {
            ResourceMetadata current = resource.getMetadata();
            resource.setMetadata(metadata.toBuilder()
                    .createdBy(current.getCreatedBy())
                    .modifiedBy(current.getModifiedBy())
                    .build()
                    .copy());
        }
        if (parentId != null) resource.setParentId(parentId.isBlank() ? null : parentId);
        if (children != null) resource.setChildren(new TreeSet<>(children));
        if (links != null) resource.setLinks(new ArrayList<>(links));
        if (lastScannedAt != null) resource.setLastScannedAt(lastScannedAt);
    }
}
