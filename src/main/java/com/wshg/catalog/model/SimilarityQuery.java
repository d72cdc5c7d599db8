package com.wshg.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Nearest-neighbour query: either an explicit vector or the id of a stored resource whose vector is used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityQuery {

    private float[] vector;
    private String resourceId;
    private int k;
    @Builder.Default
    private ResourceFilter filter = ResourceFilter.none();

    public static SimilarityQuery byVector(float[] vector, int k, ResourceFilter filter) {
        return SimilarityQuery.builder().vector(vector).k(k).filter(filter).build();
    }

    public static SimilarityQuery byResource(String resourceId, int k, ResourceFilter filter) {
        return SimilarityQuery.builder().resourceId(resourceId).k(k).filter(filter).build();
    }
}
