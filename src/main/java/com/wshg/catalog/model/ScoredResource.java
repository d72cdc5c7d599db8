package com.wshg.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Similarity hit. Distance is cosine distance in [0, 2]; lower is more similar.
 */
@Data
@AllArgsConstructor
public class ScoredResource {

    private Resource resource;
    private double distance;
}
