package com.wshg.catalog.store;

import com.wshg.catalog.entity.ResourceEntity;
import com.wshg.catalog.model.ResourceFilter;
import jakarta.persistence.criteria.MapJoin;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SQL side of {@link ResourceFilter}.
 */
public final class ResourceSpecifications {

    private ResourceSpecifications() {
    }

    public static Specification<ResourceEntity> matching(ResourceFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter == null) return cb.conjunction();
            if (filter.getProvider() != null) predicates.add(cb.equal(root.get("provider"), filter.getProvider()));
            if (filter.getType() != null) predicates.add(cb.equal(root.get("type"), filter.getType()));
            if (filter.getRegion() != null) predicates.add(cb.equal(root.get("region"), filter.getRegion()));
            if (filter.getTags() != null) {
                // one join per tag: each join matches a single map entry, so no duplicate rows
                for (Map.Entry<String, String> tag : filter.getTags().entrySet()) {
                    MapJoin<ResourceEntity, String, String> join = root.joinMap("tags");
                    predicates.add(cb.equal(join.key(), tag.getKey()));
                    predicates.add(cb.equal(join.value(), tag.getValue()));
                }
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
