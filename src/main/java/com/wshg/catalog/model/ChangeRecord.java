package com.wshg.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable, hash-linked audit entry per mutation.
 * {@code sequence} is the record's index in its resource's chain, starting at 0.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChangeRecord {

    private String id;
    private String resourceId;
    private long sequence;
    private Operation operation;
    private Map<String, Object> changes;
    private String actor;
    private Instant timestamp;
    private String previousHash;
    private String blockHash;
}
