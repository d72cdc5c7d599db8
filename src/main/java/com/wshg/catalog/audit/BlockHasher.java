package com.wshg.catalog.audit;

import com.wshg.catalog.model.ChangeRecord;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * block_hash = SHA-256(previous_block_hash + "\n" + canonical encoding of the record), hex encoded.
 *
 * <p>The canonical encoding is a key-sorted JSON object over id, resourceId, sequence, operation,
 * actor, timestamp (epoch microseconds) and changes. previousHash and blockHash are not part of it.</p>
 */
public final class BlockHasher {

    /** "previous" input of the first record of every chain. */
    public static final String GENESIS_HASH = "0".repeat(64);

    private BlockHasher() {
    }

    public static String hash(String previousHash, ChangeRecord record) {
        return DigestUtils.sha256Hex(previousHash + "\n" + canonicalEncoding(record));
    }

    public static String canonicalEncoding(ChangeRecord record) {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("id", record.getId());
        fields.put("resourceId", record.getResourceId());
        fields.put("sequence", record.getSequence());
        fields.put("operation", record.getOperation().value());
        fields.put("actor", record.getActor());
        fields.put("timestamp", epochMicros(record.getTimestamp()));
        fields.put("changes", record.getChanges() != null ? record.getChanges() : Map.of());
        return CanonicalJson.write(fields);
    }

    static long epochMicros(Instant t) {
        return Math.addExact(Math.multiplyExact(t.getEpochSecond(), 1_000_000L), t.getNano() / 1_000L);
    }
}
