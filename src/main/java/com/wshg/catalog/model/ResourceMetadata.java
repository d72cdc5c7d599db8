package com.wshg.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enrichment attached to a resource: who created and last touched it, IAM hints, custom fields.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceMetadata {

    private String createdBy;
    private String modifiedBy;
    private String environment;
    private String costCenter;
    private Map<String, Object> iam;
    private Map<String, Object> custom;

    public ResourceMetadata copy() {
        return toBuilder()
                .iam(iam != null ? new LinkedHashMap<>(iam) : null)
                .custom(custom != null ? new LinkedHashMap<>(custom) : null)
                .build();
    }
}
