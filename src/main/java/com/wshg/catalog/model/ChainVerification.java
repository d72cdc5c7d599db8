package com.wshg.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a successful chain walk.
 */
@Data
@AllArgsConstructor
public class ChainVerification {

    /** Resource id, or {@code null} for a walk over every chain. */
    private String resourceId;
    private int chainsVerified;
    private long recordsVerified;
    /** Hash of the last record walked; the genesis value when the chain is empty. */
    private String headHash;
}
