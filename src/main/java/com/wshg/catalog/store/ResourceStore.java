package com.wshg.catalog.store;

import com.wshg.catalog.model.ListQuery;
import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.ResourceFilter;
import com.wshg.catalog.model.ScoredResource;

import java.util.List;
import java.util.Optional;

/**
 * Resource persistence with an attached vector index.
 *
 * <p>Write methods must run inside the caller's transaction so that the resource row and the
 * audit record commit or roll back together. The vector index only ever reflects committed rows.</p>
 */
public interface ResourceStore {

    /** Inserts a new resource; fails if the id is taken. */
    void insert(Resource resource);

    /** Overwrites an existing resource; fails if absent. */
    void update(Resource resource);

    Optional<Resource> get(String id);

    /** Same as {@link #get} but takes a write lock on the row until the transaction ends. */
    Optional<Resource> getForUpdate(String id);

    /** @return false when no row existed */
    boolean delete(String id);

    /** Filtered, ordered, offset/limit page. Ordering is stable for identical inputs. */
    List<Resource> query(ListQuery query);

    List<Resource> children(String parentId);

    /**
     * Ranks vectorized resources matching {@code filter} by cosine distance to {@code vector}.
     * The filter applies before ranking, so up to {@code k} matching resources come back.
     *
     * @param excludeId resource id left out of the ranking, may be null
     */
    List<ScoredResource> nearestNeighbors(float[] vector, int k, ResourceFilter filter, String excludeId);

    /** Dimensionality every stored vector must have. */
    int dimensions();
}
