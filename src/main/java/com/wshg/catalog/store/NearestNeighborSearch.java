package com.wshg.catalog.store;

import com.wshg.catalog.entity.ResourceEntity;
import com.wshg.catalog.error.PersistenceException;
import com.wshg.catalog.model.ResourceFilter;
import com.wshg.catalog.model.VectorState;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exact nearest-neighbour search over committed rows, cosine distance.
 *
 * <p>Every search reads the resources table in the caller's transaction, so all instances sharing
 * the database see the same candidates. The filter runs in SQL; only id, created_at and the vector
 * are fetched for scoring. Ordering: distance ascending, then created_at descending, then id ascending.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NearestNeighborSearch {

    private static final Comparator<Hit> RANKING = Comparator.comparingDouble(Hit::getDistance)
            .thenComparing(Hit::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Hit::getId);

    private final EntityManager entityManager;
    private final ResourceMapper mapper;

    /**
     * Must run inside a transaction.
     *
     * @param excludeId id left out of the candidates, may be null
     */
    public List<Hit> search(float[] query, int k, ResourceFilter filter, String excludeId) {
        if (query == null || k < 1) return List.of();
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> q = cb.createTupleQuery();
        Root<ResourceEntity> root = q.from(ResourceEntity.class);

        List<Predicate> where = new ArrayList<>();
        where.add(ResourceSpecifications.matching(filter).toPredicate(root, q, cb));
        where.add(cb.equal(root.get("vectorState"), VectorState.ACTIVE));
        where.add(cb.isNotNull(root.get("embeddingJson")));
        if (excludeId != null) where.add(cb.notEqual(root.get("id"), excludeId));

        q.multiselect(root.get("id"), root.get("createdAt"), root.get("embeddingJson"))
                .where(where.toArray(new Predicate[0]));

        List<Tuple> rows;
        try {
            rows = entityManager.createQuery(q).getResultList();
        } catch (jakarta.persistence.PersistenceException ex) {
            throw new PersistenceException("failed to scan vectors", ex);
        }
        List<Hit> hits = new ArrayList<>();
        int skipped = 0;
        for (Tuple row : rows) {
            float[] vector = mapper.parseVector(row.get(2, String.class));
            if (vector == null || vector.length != query.length) {
                skipped++;
                continue;
            }
            hits.add(new Hit(row.get(0, String.class), cosineDistance(query, vector), row.get(1, Instant.class)));
        }
        log.debug("[VectorSearch] scored={}, skipped={}, k={}", hits.size(), skipped, k);
        return rank(hits, k);
    }

    static List<Hit> rank(List<Hit> hits, int k) {
        List<Hit> sorted = new ArrayList<>(hits);
        sorted.sort(RANKING);
        return sorted.size() > k ? new ArrayList<>(sorted.subList(0, k)) : sorted;
    }

    /**
     * 1 - cosine similarity, in [0, 2]. A zero vector is at distance 1 from everything.
     */
    public static double cosineDistance(float[] a, float[] b) {
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        double denom = Math.sqrt(normA) * Math.sqrt(normB);
        if (denom == 0) return 1.0;
        double similarity = Math.max(-1.0, Math.min(1.0, dot / denom));
        return 1.0 - similarity;
    }

    @Getter
    @AllArgsConstructor
    public static class Hit {
        private final String id;
        private final double distance;
        private final Instant createdAt;
    }
}
