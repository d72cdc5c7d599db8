package com.wshg.catalog.error;

/**
 * A change record no longer hashes to its stored value, or its link to the
 * predecessor is wrong. Raised only by chain verification and never repaired.
 */
public class ChainBrokenException extends CatalogException {

    private final String resourceId;
    private final int index;
    private final String recordId;

    public ChainBrokenException(String resourceId, int index, String recordId, String expectedHash, String actualHash) {
        super(ErrorKind.CHAIN_BROKEN, "chain broken for resource " + resourceId + " at index " + index
                + " (record " + recordId + ")");
        this.resourceId = resourceId;
        this.index = index;
        this.recordId = recordId;
        detail("resourceId", resourceId);
        detail("index", index);
        detail("recordId", recordId);
        detail("expectedHash", expectedHash);
        detail("actualHash", actualHash);
    }

    public String getResourceId() {
        return resourceId;
    }

    public int getIndex() {
        return index;
    }

    public String getRecordId() {
        return recordId;
    }
}
