package com.wshg.catalog.audit;

import com.wshg.catalog.error.ChainBrokenException;
import com.wshg.catalog.model.ChainVerification;
import com.wshg.catalog.model.ChangeRecord;

import java.util.List;

/**
 * Append-only, hash-linked change log with one chain per resource id.
 */
public interface AuditChain {

    /**
     * Links the record onto the head of its resource's chain and stores it.
     * Must run inside the transaction of the mutation it records.
     *
     * @param draft record without id, sequence or hashes
     * @return the stored record, hashes filled in
     */
    ChangeRecord append(ChangeRecord draft);

    /** Records of one chain in chain order; empty for an unknown id. */
    List<ChangeRecord> trail(String resourceId);

    /**
     * Recomputes every hash of one chain.
     *
     * @throws ChainBrokenException at the first record that does not reproduce
     */
    ChainVerification verify(String resourceId);

    /** Verifies every chain in the ledger. */
    ChainVerification verifyAll();
}
