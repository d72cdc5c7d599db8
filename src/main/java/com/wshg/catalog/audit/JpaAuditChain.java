package com.wshg.catalog.audit;

import com.wshg.catalog.entity.ChangeRecordEntity;
import com.wshg.catalog.error.ChainBrokenException;
import com.wshg.catalog.error.PersistenceException;
import com.wshg.catalog.model.ChainVerification;
import com.wshg.catalog.model.ChangeRecord;
import com.wshg.catalog.model.Operation;
import com.wshg.catalog.repository.ChangeRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Audit chain stored in the change_records table, in the same database as the resources.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAuditChain implements AuditChain {

    private final ChangeRecordRepository repository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public ChangeRecord append(ChangeRecord draft) {
        Optional<ChangeRecordEntity> head;
        try {
            head = repository.findFirstByResourceIdOrderBySequenceDesc(draft.getResourceId());
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to read chain head of " + draft.getResourceId(), ex);
        }
        String previousHash = head.map(ChangeRecordEntity::getBlockHash).orElse(BlockHasher.GENESIS_HASH);
        long sequence = head.map(h -> h.getSequence() + 1).orElse(0L);
        Instant timestamp = (draft.getTimestamp() != null ? draft.getTimestamp() : Instant.now())
                .truncatedTo(ChronoUnit.MICROS);
        // normalize through JSON so the hashed structure is exactly what gets stored
        String changesJson = CanonicalJson.write(draft.getChanges() != null ? draft.getChanges() : Map.of());

        ChangeRecord record = draft.toBuilder()
                .id(UUID.randomUUID().toString())
                .sequence(sequence)
                .timestamp(timestamp)
                .changes(CanonicalJson.readMap(changesJson))
                .previousHash(previousHash)
                .build();
        record.setBlockHash(BlockHasher.hash(previousHash, record));

        try {
            repository.saveAndFlush(toEntity(record, changesJson));
        } catch (DataIntegrityViolationException ex) {
            throw new PersistenceException("chain position " + sequence + " of " + record.getResourceId()
                    + " already taken by a concurrent append", ex);
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to append change record for " + record.getResourceId(), ex);
        }
        log.debug("[AuditChain] append resource={}, seq={}, op={}, hash={}",
                record.getResourceId(), sequence, record.getOperation().value(), record.getBlockHash());
        return record;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChangeRecord> trail(String resourceId) {
        try {
            return repository.findByResourceIdOrderBySequenceAsc(resourceId).stream()
                    .map(JpaAuditChain::toRecord)
                    .collect(Collectors.toList());
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to read audit trail of " + resourceId, ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public ChainVerification verify(String resourceId) {
        List<ChangeRecordEntity> chain;
        try {
            chain = repository.findByResourceIdOrderBySequenceAsc(resourceId);
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to read audit trail of " + resourceId, ex);
        }
        String expectedPrevious = BlockHasher.GENESIS_HASH;
        for (int i = 0; i < chain.size(); i++) {
            ChangeRecordEntity e = chain.get(i);
            if (e.getSequence() != i || !expectedPrevious.equals(e.getPreviousHash())) {
                throw broken(resourceId, i, e, expectedPrevious, e.getPreviousHash());
            }
            String recomputed;
            try {
                recomputed = BlockHasher.hash(expectedPrevious, toRecord(e));
            } catch (IllegalArgumentException ex) {
                // unparseable changes_json
                throw broken(resourceId, i, e, e.getBlockHash(), "<undecodable>");
            }
            if (!recomputed.equals(e.getBlockHash())) {
                throw broken(resourceId, i, e, recomputed, e.getBlockHash());
            }
            expectedPrevious = e.getBlockHash();
        }
        log.debug("[AuditChain] verified resource={}, records={}", resourceId, chain.size());
        return new ChainVerification(resourceId, 1, chain.size(), expectedPrevious);
    }

    @Override
    @Transactional(readOnly = true)
    public ChainVerification verifyAll() {
        List<String> ids;
        try {
            ids = repository.findChainIds();
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to list audit chains", ex);
        }
        long records = 0;
        for (String id : ids) {
            records += verify(id).getRecordsVerified();
        }
        log.info("[AuditChain] verified all chains: chains={}, records={}", ids.size(), records);
        return new ChainVerification(null, ids.size(), records, null);
    }

    private static ChainBrokenException broken(String resourceId, int index, ChangeRecordEntity e, String expected, String actual) {
        log.error("[AuditChain] integrity failure resource={}, index={}, record={}", resourceId, index, e.getId());
        return new ChainBrokenException(resourceId, index, e.getId(), expected, actual);
    }

    private static ChangeRecordEntity toEntity(ChangeRecord r, String changesJson) {
        return ChangeRecordEntity.builder()
                .id(r.getId())
                .resourceId(r.getResourceId())
                .sequence(r.getSequence())
                .operation(r.getOperation().value())
                .actor(r.getActor())
                .changesJson(changesJson)
                .timestamp(r.getTimestamp())
                .previousHash(r.getPreviousHash())
                .blockHash(r.getBlockHash())
                .build();
    }

    private static ChangeRecord toRecord(ChangeRecordEntity e) {
        return ChangeRecord.builder()
                .id(e.getId())
                .resourceId(e.getResourceId())
                .sequence(e.getSequence())
                .operation(Operation.fromValue(e.getOperation()))
                .actor(e.getActor())
                .changes(CanonicalJson.readMap(e.getChangesJson()))
                .timestamp(e.getTimestamp())
                .previousHash(e.getPreviousHash())
                .blockHash(e.getBlockHash())
                .build();
    }
}
