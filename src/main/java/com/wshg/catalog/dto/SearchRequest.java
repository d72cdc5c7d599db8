package com.wshg.catalog.dto;

import com.wshg.catalog.model.ResourceFilter;
import com.wshg.catalog.model.SimilarityQuery;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of POST /api/resources/search. Exactly one of {@code vector} or {@code resourceId} is used;
 * the vector wins when both are present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    private float[] vector;
    private String resourceId;
    /** Null means the configured default. */
    private Integer k;
    private String provider;
    private String type;
    private String region;
    private Map<String, String> tags;

    public SimilarityQuery toQuery(int defaultK) {
        ResourceFilter filter = ResourceFilter.builder()
                .provider(provider)
                .type(type)
                .region(region)
                .tags(tags != null ? new LinkedHashMap<>(tags) : new LinkedHashMap<>())
                .build();
        return SimilarityQuery.builder()
                .vector(vector)
                .resourceId(resourceId)
                .k(k != null ? k : defaultK)
                .filter(filter)
                .build();
    }
}
