package com.wshg.catalog.store;

import com.wshg.catalog.config.CatalogProperties;
import com.wshg.catalog.entity.ResourceEntity;
import com.wshg.catalog.error.PersistenceException;
import com.wshg.catalog.error.ResourceNotFoundException;
import com.wshg.catalog.error.VectorDimensionMismatchException;
import com.wshg.catalog.model.ListQuery;
import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.ResourceFilter;
import com.wshg.catalog.model.ScoredResource;
import com.wshg.catalog.repository.ResourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Relational resource store (JPA); similarity queries go through {@link NearestNeighborSearch} on the same tables.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaResourceStore implements ResourceStore {

    private final ResourceRepository repository;
    private final ResourceMapper mapper;
    private final NearestNeighborSearch search;
    private final CatalogProperties props;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void insert(Resource resource) {
        checkDimensions(resource.getVector());
        try {
            if (repository.existsById(resource.getId())) {
                throw new PersistenceException("resource already exists: " + resource.getId());
            }
            ResourceEntity e = new ResourceEntity();
            mapper.copyInto(resource, e);
            repository.saveAndFlush(e);
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to insert resource " + resource.getId() + ": " + ex.getMostSpecificCause().getMessage(), ex);
        }
        log.debug("[Store] insert id={}, state={}", resource.getId(), resource.getVectorState());
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void update(Resource resource) {
        checkDimensions(resource.getVector());
        try {
            ResourceEntity e = repository.findById(resource.getId())
                    .orElseThrow(() -> new ResourceNotFoundException(resource.getId()));
            mapper.copyInto(resource, e);
            repository.saveAndFlush(e);
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to update resource " + resource.getId() + ": " + ex.getMostSpecificCause().getMessage(), ex);
        }
        log.debug("[Store] update id={}, state={}", resource.getId(), resource.getVectorState());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Resource> get(String id) {
        try {
            return repository.findById(id).map(mapper::toResource);
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to read resource " + id, ex);
        }
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Resource> getForUpdate(String id) {
        try {
            return repository.findByIdForUpdate(id).map(mapper::toResource);
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to lock resource " + id, ex);
        }
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean delete(String id) {
        try {
            if (!repository.existsById(id)) return false;
            repository.deleteById(id);
            repository.flush();
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to delete resource " + id + ": " + ex.getMostSpecificCause().getMessage(), ex);
        }
        log.debug("[Store] delete id={}", id);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Resource> query(ListQuery query) {
        Sort.Direction dir = query.isAscending() ? Sort.Direction.ASC : Sort.Direction.DESC;
        Sort sort = Sort.by(dir, query.getSortBy().property()).and(Sort.by(Sort.Direction.ASC, "id"));
        OffsetLimitRequest page = new OffsetLimitRequest(query.getOffset(), query.getLimit(), sort);
        try {
            return repository.findAll(ResourceSpecifications.matching(query.getFilter()), page)
                    .map(mapper::toResource)
                    .getContent();
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to query resources", ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Resource> children(String parentId) {
        try {
            return repository.findByParentIdOrderByCreatedAtDescIdAsc(parentId).stream()
                    .map(mapper::toResource)
                    .collect(Collectors.toList());
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to read children of " + parentId, ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScoredResource> nearestNeighbors(float[] vector, int k, ResourceFilter filter, String excludeId) {
        checkDimensions(vector);
        int limit = Math.min(Math.max(k, 1), props.getSearchMaxK());
        List<NearestNeighborSearch.Hit> hits = search.search(vector, limit, filter, excludeId);
        if (hits.isEmpty()) return List.of();
        Map<String, ResourceEntity> rows;
        try {
            rows = repository.findAllById(hits.stream().map(NearestNeighborSearch.Hit::getId).collect(Collectors.toList()))
                    .stream()
                    .collect(Collectors.toMap(ResourceEntity::getId, Function.identity()));
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to load similarity hits", ex);
        }
        List<ScoredResource> results = new ArrayList<>(hits.size());
        for (NearestNeighborSearch.Hit hit : hits) {
            ResourceEntity e = rows.get(hit.getId());
            // deleted between the scan and this read
            if (e == null) continue;
            results.add(new ScoredResource(mapper.toResource(e), hit.getDistance()));
        }
        return results;
    }

    @Override
    public int dimensions() {
        return props.getEmbeddingDimensions();
    }

    private void checkDimensions(float[] vector) {
        if (vector != null && vector.length != dimensions()) {
            throw new VectorDimensionMismatchException(dimensions(), vector.length);
        }
    }
}
