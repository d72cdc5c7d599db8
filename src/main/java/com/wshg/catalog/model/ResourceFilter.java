package com.wshg.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equality filters shared by listing and similarity search. Null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceFilter {

    private String provider;
    private String type;
    private String region;
    /** Every entry must be present on the resource with the same value. */
    @Builder.Default
    private Map<String, String> tags = new LinkedHashMap<>();

    public static ResourceFilter none() {
        return new ResourceFilter();
    }

    public static ResourceFilter provider(String provider) {
        return ResourceFilter.builder().provider(provider).build();
    }
}
