package com.wshg.catalog.model;

/**
 * Lifecycle status of a stored resource. Deleted resources have no row, only their audit trail.
 */
public enum VectorState {
    /** Persisted without a vector; excluded from similarity search. */
    UNVECTORIZED,
    ACTIVE
}
