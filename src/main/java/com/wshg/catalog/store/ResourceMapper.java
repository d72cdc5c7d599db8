package com.wshg.catalog.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.catalog.entity.ResourceEntity;
import com.wshg.catalog.error.PersistenceException;
import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.ResourceLink;
import com.wshg.catalog.model.ResourceMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Resource model to/from its JPA row. Any JSON failure is a persistence failure.
 */
@Component
@RequiredArgsConstructor
public class ResourceMapper {

    private final ObjectMapper objectMapper;

    public void copyInto(Resource r, ResourceEntity e) {
        e.setId(r.getId());
        e.setType(r.getType());
        e.setProvider(r.getProvider());
        e.setRegion(r.getRegion());
        e.setName(r.getName());
        e.setDataJson(write(r.getData() != null ? r.getData() : Map.of()));
        e.setMetadataJson(r.getMetadata() != null ? write(r.getMetadata()) : null);
        e.setEmbeddingJson(r.isVectorized() ? write(r.getVector()) : null);
        e.setVectorState(r.getVectorState());
        e.setParentId(r.getParentId());
        e.setChildrenJson(r.getChildren() != null && !r.getChildren().isEmpty() ? write(r.getChildren()) : null);
        e.setLinksJson(r.getLinks() != null && !r.getLinks().isEmpty() ? write(r.getLinks()) : null);
        Map<String, String> tags = e.getTags();
        if (tags == null) {
            tags = new LinkedHashMap<>();
            e.setTags(tags);
        }
        tags.clear();
        if (r.getTags() != null) tags.putAll(r.getTags());
        e.setCreatedAt(r.getCreatedAt());
        e.setUpdatedAt(r.getUpdatedAt());
        e.setLastScannedAt(r.getLastScannedAt());
    }

    public Resource toResource(ResourceEntity e) {
        return Resource.builder()
                .id(e.getId())
                .type(e.getType())
                .provider(e.getProvider())
                .region(e.getRegion())
                .name(e.getName())
                .data(read(e.getDataJson(), new TypeReference<LinkedHashMap<String, Object>>() {}, new LinkedHashMap<>()))
                .tags(e.getTags() != null ? new LinkedHashMap<>(e.getTags()) : new LinkedHashMap<>())
                .metadata(read(e.getMetadataJson(), new TypeReference<ResourceMetadata>() {}, new ResourceMetadata()))
                .vector(parseVector(e.getEmbeddingJson()))
                .vectorState(e.getVectorState())
                .parentId(e.getParentId())
                .children(read(e.getChildrenJson(), new TypeReference<TreeSet<String>>() {}, new TreeSet<>()))
                .links(read(e.getLinksJson(), new TypeReference<ArrayList<ResourceLink>>() {}, new ArrayList<>()))
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .lastScannedAt(e.getLastScannedAt())
                .build();
    }

    public float[] parseVector(String json) {
        if (json == null || json.isBlank()) return null;
        return read(json, new TypeReference<float[]>() {}, null);
    }

    public List<String> readStringList(String json) {
        return read(json, new TypeReference<ArrayList<String>>() {}, new ArrayList<>());
    }

    public Map<String, Object> readMap(String json) {
        return read(json, new TypeReference<LinkedHashMap<String, Object>>() {}, null);
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new PersistenceException("failed to encode " + value.getClass().getSimpleName(), ex);
        }
    }

    private <T> T read(String json, TypeReference<T> type, T empty) {
        if (json == null || json.isBlank()) return empty;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new PersistenceException("failed to decode stored JSON: " + ex.getOriginalMessage(), ex);
        }
    }
}
