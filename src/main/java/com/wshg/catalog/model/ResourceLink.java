package com.wshg.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Typed relation to another resource, by id only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceLink {

    public enum Direction {
        INBOUND,
        OUTBOUND,
        BIDIRECTIONAL
    }

    private String targetId;
    private String type;
    private Direction direction;
    private Map<String, String> properties;
}
