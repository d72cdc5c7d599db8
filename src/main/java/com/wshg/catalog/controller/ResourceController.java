package com.wshg.catalog.controller;

import com.wshg.catalog.config.CatalogProperties;
import com.wshg.catalog.dto.CreateResourceRequest;
import com.wshg.catalog.dto.SearchRequest;
import com.wshg.catalog.dto.UpdateResourceRequest;
import com.wshg.catalog.error.ValidationException;
import com.wshg.catalog.model.ListQuery;
import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.ResourceFilter;
import com.wshg.catalog.model.ScoredResource;
import com.wshg.catalog.model.SimilarityQuery;
import com.wshg.catalog.service.ResourceLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

/**
 * Resource CRUD, listing and similarity search.
 * Mutations take the acting principal from {@code X-Actor} and an optional deadline from {@code X-Request-Timeout-Ms}.
 */
@Slf4j
@RestController
@RequestMapping("/api/resources")
@RequiredArgsConstructor
public class ResourceController {

    private final ResourceLifecycleService lifecycleService;
    private final CatalogProperties props;

    @PostMapping
    public ResponseEntity<Resource> create(@RequestBody CreateResourceRequest request,
                                           @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) String actor,
                                           @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        log.info("[API] POST /api/resources id={}, type={}, provider={}, actor={}",
                request.getId(), request.getType(), request.getProvider(), actor);
        Resource created = lifecycleService.createResource(request, actor, RequestContext.deadline(timeoutMs, props));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public Resource get(@PathVariable String id) {
        return lifecycleService.getResource(id);
    }

    @PutMapping("/{id}")
    public Resource update(@PathVariable String id,
                           @RequestBody UpdateResourceRequest patch,
                           @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) String actor,
                           @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        log.info("[API] PUT /api/resources/{} actor={}", id, actor);
        return lifecycleService.updateResource(id, patch, actor, RequestContext.deadline(timeoutMs, props));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id,
                                       @RequestHeader(value = RequestContext.ACTOR_HEADER, required = false) String actor,
                                       @RequestHeader(value = RequestContext.TIMEOUT_HEADER, required = false) Long timeoutMs) {
        log.info("[API] DELETE /api/resources/{} actor={}", id, actor);
        lifecycleService.deleteResource(id, actor, RequestContext.deadline(timeoutMs, props));
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /api/resources?provider=aws&type=vm&region=us-east-1&tag=env:prod&offset=0&limit=50&sort=created_at&order=desc
     */
    @GetMapping
    public List<Resource> list(@RequestParam(required = false) String provider,
                               @RequestParam(required = false) String type,
                               @RequestParam(required = false) String region,
                               @RequestParam(required = false, name = "tag") List<String> tags,
                               @RequestParam(defaultValue = "0") int offset,
                               @RequestParam(required = false) Integer limit,
                               @RequestParam(defaultValue = "created_at") String sort,
                               @RequestParam(defaultValue = "desc") String order) {
        ListQuery query = ListQuery.builder()
                .filter(ResourceFilter.builder()
                        .provider(provider)
                        .type(type)
                        .region(region)
                        .tags(RequestContext.tags(tags))
                        .build())
                .offset(offset)
                .limit(limit)
                .sortBy(sortField(sort))
                .ascending(ascending(order))
                .build();
        return lifecycleService.listResources(query);
    }

    @GetMapping("/{id}/children")
    public List<Resource> children(@PathVariable String id) {
        return lifecycleService.getChildren(id);
    }

    /**
     * Resources most similar to the given one, the resource itself excluded.
     */
    @GetMapping("/{id}/similar")
    public List<ScoredResource> similar(@PathVariable String id,
                                        @RequestParam(required = false) Integer k,
                                        @RequestParam(required = false) String provider,
                                        @RequestParam(required = false) String type) {
        ResourceFilter filter = ResourceFilter.builder().provider(provider).type(type).build();
        return lifecycleService.searchSimilar(
                SimilarityQuery.byResource(id, k != null ? k : props.getSearchDefaultK(), filter));
    }

    @PostMapping("/search")
    public List<ScoredResource> search(@RequestBody SearchRequest request) {
        log.info("[API] POST /api/resources/search resourceId={}, k={}, provider={}, type={}",
                request.getResourceId(), request.getK(), request.getProvider(), request.getType());
        List<ScoredResource> hits = lifecycleService.searchSimilar(request.toQuery(props.getSearchDefaultK()));
        log.info("[API] /resources/search hits={}", hits.size());
        return hits;
    }

    private static ListQuery.SortField sortField(String sort) {
        switch (sort.toLowerCase(Locale.ROOT)) {
            case "created_at":
                return ListQuery.SortField.CREATED_AT;
            case "updated_at":
                return ListQuery.SortField.UPDATED_AT;
            case "name":
                return ListQuery.SortField.NAME;
            default:
                throw ValidationException.invalidValue("sort", "sort must be created_at, updated_at or name");
        }
    }

    private static boolean ascending(String order) {
        if ("asc".equalsIgnoreCase(order)) return true;
        if ("desc".equalsIgnoreCase(order)) return false;
        throw ValidationException.invalidValue("order", "order must be asc or desc");
    }
}
