package com.wshg.catalog.service;

import com.wshg.catalog.audit.AuditChain;
import com.wshg.catalog.audit.ChangeDiff;
import com.wshg.catalog.config.CatalogProperties;
import com.wshg.catalog.dto.CreateResourceRequest;
import com.wshg.catalog.dto.UpdateResourceRequest;
import com.wshg.catalog.embedding.EmbeddingPort;
import com.wshg.catalog.embedding.ResourceToVectorHelper;
import com.wshg.catalog.error.CatalogException;
import com.wshg.catalog.error.EmbeddingException;
import com.wshg.catalog.error.OperationTimeoutException;
import com.wshg.catalog.error.PersistenceException;
import com.wshg.catalog.error.ResourceNotFoundException;
import com.wshg.catalog.error.ValidationException;
import com.wshg.catalog.model.ChainVerification;
import com.wshg.catalog.model.ChangeRecord;
import com.wshg.catalog.model.Deadline;
import com.wshg.catalog.model.ListQuery;
import com.wshg.catalog.model.Operation;
import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.ResourceFilter;
import com.wshg.catalog.model.ResourceMetadata;
import com.wshg.catalog.model.ResourceSchema;
import com.wshg.catalog.model.ScoredResource;
import com.wshg.catalog.model.SimilarityQuery;
import com.wshg.catalog.model.VectorState;
import com.wshg.catalog.store.ResourceStore;
import com.wshg.catalog.validation.ResourceValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Operation surface of the catalog. Each mutation runs validate, embed, persist and audit in that
 * order; the resource row and its change record commit in one transaction or not at all.
 *
 * <p>Embedding happens outside the database transaction. Mutations of one resource id are
 * serialized by {@link ResourceLockRegistry} and, within the transaction, by a row lock.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceLifecycleService {

    private static final String SYSTEM_ACTOR = "system";

    private final ResourceStore store;
    private final AuditChain auditChain;
    private final EmbeddingPort embeddingPort;
    private final ResourceValidator validator;
    private final SchemaRegistryService schemas;
    private final ResourceLockRegistry locks;
    private final PlatformTransactionManager transactionManager;
    private final CatalogProperties props;

    // ==================== mutations ====================

    public Resource createResource(CreateResourceRequest request, String actor) {
        return createResource(request, actor, defaultDeadline());
    }

    public Resource createResource(CreateResourceRequest request, String actor, Deadline deadline) {
        if (request == null) throw ValidationException.missingField("resource");
        deadline.check("create");
        String who = actorOf(actor);

        Resource resource = request.toResource();
        if (resource.getId() == null || resource.getId().isBlank()) {
            resource.setId(UUID.randomUUID().toString());
        }
        validator.validate(resource, schemaFor(resource));

        if (store.get(resource.getId()).isPresent()) {
            throw new PersistenceException("resource already exists: " + resource.getId());
        }

        Instant now = now();
        resource.setCreatedAt(now);
        resource.setUpdatedAt(now);
        ResourceMetadata metadata = resource.getMetadata() != null ? resource.getMetadata() : new ResourceMetadata();
        metadata.setCreatedBy(who);
        metadata.setModifiedBy(who);
        resource.setMetadata(metadata);

        if (props.isEmbeddingEnabled()) {
            deadline.check("create");
            resource.setVector(embed(resource));
            resource.setVectorState(VectorState.ACTIVE);
        } else {
            resource.setVector(null);
            resource.setVectorState(VectorState.UNVECTORIZED);
        }

        ReentrantLock lock = locks.acquire(resource.getId(), deadline, "create");
        try {
            ChangeRecord record = inTransaction(deadline, "create", () -> {
                store.insert(resource);
                return auditChain.append(draft(resource.getId(), Operation.CREATE, who, now,
                        Map.of("snapshot", ChangeDiff.snapshot(resource))));
            });
            log.info("[Catalog] created id={}, type={}, provider={}, state={}, actor={}, hash={}",
                    resource.getId(), resource.getType(), resource.getProvider(),
                    resource.getVectorState(), who, record.getBlockHash());
        } catch (CatalogException ex) {
            log.warn("[Catalog] create failed id={}, kind={}: {}", resource.getId(), ex.getKind(), ex.getMessage());
            throw ex;
        } finally {
            lock.unlock();
        }
        return resource;
    }

    public Resource updateResource(String id, UpdateResourceRequest patch, String actor) {
        return updateResource(id, patch, actor, defaultDeadline());
    }

    public Resource updateResource(String id, UpdateResourceRequest patch, String actor, Deadline deadline) {
        requireId(id);
        if (patch == null) throw ValidationException.missingField("patch");
        deadline.check("update");
        String who = actorOf(actor);

        ReentrantLock lock = locks.acquire(id, deadline, "update");
        try {
            Resource before = store.get(id).orElseThrow(() -> new ResourceNotFoundException(id));
            Resource after = before.copy();
            patch.applyTo(after);
            validator.validate(after, schemaFor(after));

            boolean inputChanged = ResourceToVectorHelper.vectorInputChanged(before, after);
            boolean regenerate = false;
            if (props.isEmbeddingEnabled()) {
                if (inputChanged || !before.isVectorized()) {
                    deadline.check("update");
                    after.setVector(embed(after));
                    after.setVectorState(VectorState.ACTIVE);
                    regenerate = true;
                }
            } else if (inputChanged) {
                // the stored vector no longer describes the resource
                after.setVector(null);
                after.setVectorState(VectorState.UNVECTORIZED);
            }

            Instant now = now();
            after.setUpdatedAt(now);
            after.getMetadata().setModifiedBy(who);

            Map<String, Object> diff = ChangeDiff.between(before, after);
            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("diff", diff);
            changes.put("vectorRegenerated", regenerate);

            ChangeRecord record = inTransaction(deadline, "update", () -> {
                Resource locked = store.getForUpdate(id).orElseThrow(() -> new ResourceNotFoundException(id));
                if (!Objects.equals(locked.getUpdatedAt(), before.getUpdatedAt())) {
                    throw new PersistenceException("resource " + id + " was modified concurrently");
                }
                store.update(after);
                return auditChain.append(draft(id, Operation.UPDATE, who, now, changes));
            });
            log.info("[Catalog] updated id={}, fields={}, vectorRegenerated={}, actor={}, seq={}",
                    id, diff.keySet(), regenerate, who, record.getSequence());
            return after;
        } catch (CatalogException ex) {
            log.warn("[Catalog] update failed id={}, kind={}: {}", id, ex.getKind(), ex.getMessage());
            throw ex;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends the delete record first, then removes the row, in one transaction.
     * If the append fails the resource stays untouched.
     */
    public void deleteResource(String id, String actor) {
        deleteResource(id, actor, defaultDeadline());
    }

    public void deleteResource(String id, String actor, Deadline deadline) {
        requireId(id);
        deadline.check("delete");
        String who = actorOf(actor);

        ReentrantLock lock = locks.acquire(id, deadline, "delete");
        try {
            ChangeRecord record = inTransaction(deadline, "delete", () -> {
                Resource current = store.getForUpdate(id).orElseThrow(() -> new ResourceNotFoundException(id));
                ChangeRecord appended = auditChain.append(draft(id, Operation.DELETE, who, now(),
                        Map.of("snapshot", ChangeDiff.snapshot(current))));
                if (!store.delete(id)) throw new ResourceNotFoundException(id);
                return appended;
            });
            log.info("[Catalog] deleted id={}, actor={}, seq={}", id, who, record.getSequence());
        } catch (CatalogException ex) {
            log.warn("[Catalog] delete failed id={}, kind={}: {}", id, ex.getKind(), ex.getMessage());
            throw ex;
        } finally {
            lock.unlock();
        }
    }

    // ==================== reads ====================

    public Resource getResource(String id) {
        requireId(id);
        return store.get(id).orElseThrow(() -> new ResourceNotFoundException(id));
    }

    public List<Resource> listResources(ListQuery query) {
        ListQuery q = query != null ? query : ListQuery.all();
        if (q.getOffset() < 0) throw ValidationException.invalidValue("offset", "offset must be >= 0");
        if (q.getLimit() != null && q.getLimit() < 0) throw ValidationException.invalidValue("limit", "limit must be >= 0");

        validator.validateFilter(q.getFilter());

        int limit = q.getLimit() == null || q.getLimit() == 0 ? props.getListDefaultLimit() : q.getLimit();
        ListQuery normalized = ListQuery.builder()
                .filter(q.getFilter() != null ? q.getFilter() : ResourceFilter.none())
                .offset(q.getOffset())
                .limit(Math.min(limit, props.getListMaxLimit()))
                .sortBy(q.getSortBy() != null ? q.getSortBy() : ListQuery.SortField.CREATED_AT)
                .ascending(q.isAscending())
                .build();
        List<Resource> page = store.query(normalized);
        log.debug("[Catalog] list filter={}, offset={}, limit={}, returned={}",
                normalized.getFilter(), normalized.getOffset(), normalized.getLimit(), page.size());
        return page;
    }

    /**
     * Ranks by ascending cosine distance. Querying by resource id leaves that resource out of the results.
     */
    public List<ScoredResource> searchSimilar(SimilarityQuery query) {
        if (query == null) throw ValidationException.missingField("query");
        if (query.getK() < 1) throw ValidationException.invalidValue("k", "k must be >= 1");
        ResourceFilter filter = query.getFilter() != null ? query.getFilter() : ResourceFilter.none();
        validator.validateFilter(filter);

        float[] vector;
        String excludeId = null;
        if (query.getVector() != null) {
            vector = query.getVector();
            if (vector.length != store.dimensions()) {
                throw ValidationException.invalidValue("vector",
                        "query vector has " + vector.length + " dimensions, store uses " + store.dimensions());
            }
        } else if (query.getResourceId() != null && !query.getResourceId().isBlank()) {
            Resource anchor = getResource(query.getResourceId());
            if (!anchor.isVectorized()) {
                throw ValidationException.invalidValue("resourceId", "resource " + anchor.getId() + " has no vector");
            }
            vector = anchor.getVector();
            excludeId = anchor.getId();
        } else {
            throw ValidationException.missingField("vector");
        }

        List<ScoredResource> hits = store.nearestNeighbors(vector, query.getK(), filter, excludeId);
        log.debug("[Catalog] search k={}, filter={}, anchor={}, hits={}", query.getK(), filter, excludeId, hits.size());
        return hits;
    }

    public List<Resource> getChildren(String parentId) {
        requireId(parentId);
        return store.children(parentId);
    }

    // ==================== audit ====================

    public List<ChangeRecord> getAuditTrail(String resourceId) {
        requireId(resourceId);
        return auditChain.trail(resourceId);
    }

    public ChainVerification verifyChain(String resourceId) {
        requireId(resourceId);
        return auditChain.verify(resourceId);
    }

    public ChainVerification verifyAllChains() {
        return auditChain.verifyAll();
    }

    // ==================== helpers ====================

    private float[] embed(Resource resource) {
        float[] vector;
        try {
            vector = embeddingPort.generateVector(
                    ResourceToVectorHelper.buildContent(resource),
                    ResourceToVectorHelper.buildMetadata(resource));
        } catch (EmbeddingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new EmbeddingException("embedding failed for " + resource.getId() + ": " + ex.getMessage(), ex);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("embedding port returned no vector for " + resource.getId());
        }
        return vector;
    }

    /**
     * Runs {@code work} in a transaction bounded by the deadline. The deadline is checked once more
     * before commit so an overdue operation rolls back instead of committing late.
     */
    private <T> T inTransaction(Deadline deadline, String operation, Supplier<T> work) {
        deadline.check(operation);
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        tx.setTimeout(deadline.remainingSeconds());
        try {
            return tx.execute(status -> {
                T result = work.get();
                deadline.check(operation);
                return result;
            });
        } catch (TransactionTimedOutException ex) {
            throw new OperationTimeoutException(operation, ex);
        } catch (TransactionException ex) {
            throw new PersistenceException(operation + " transaction failed: " + ex.getMessage(), ex);
        }
    }

    private ResourceSchema schemaFor(Resource resource) {
        return schemas.find(resource.getProvider(), resource.getType()).orElse(null);
    }

    private static ChangeRecord draft(String id, Operation op, String actor, Instant at, Map<String, Object> changes) {
        return ChangeRecord.builder()
                .resourceId(id)
                .operation(op)
                .actor(actor)
                .timestamp(at)
                .changes(changes)
                .build();
    }

    private Deadline defaultDeadline() {
        return Deadline.after(props.getOperationTimeout());
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    private static String actorOf(String actor) {
        return actor == null || actor.isBlank() ? SYSTEM_ACTOR : actor;
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) throw ValidationException.missingField("id");
    }
}
