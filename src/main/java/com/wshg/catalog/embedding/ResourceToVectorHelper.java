package com.wshg.catalog.embedding;

import com.wshg.catalog.audit.CanonicalJson;
import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.ResourceMetadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the embedding port's input from a resource. Only the fields returned here
 * influence the vector, so an update that leaves them unchanged keeps the old vector.
 */
public final class ResourceToVectorHelper {

    private ResourceToVectorHelper() {
    }

    public static Map<String, Object> buildContent(Resource r) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("type", r.getType());
        content.put("provider", r.getProvider());
        content.put("region", r.getRegion() != null ? r.getRegion() : "");
        content.put("name", r.getName() != null ? r.getName() : "");
        content.put("data", r.getData() != null ? r.getData() : Map.of());
        content.put("tags", r.getTags() != null ? r.getTags() : Map.of());
        return content;
    }

    /**
     * Metadata without created-by/modified-by, which change on every write and say nothing about the resource.
     */
    public static Map<String, Object> buildMetadata(Resource r) {
        ResourceMetadata m = r.getMetadata();
        Map<String, Object> meta = new LinkedHashMap<>();
        if (m == null) return meta;
        if (m.getEnvironment() != null) meta.put("environment", m.getEnvironment());
        if (m.getCostCenter() != null) meta.put("costCenter", m.getCostCenter());
        if (m.getIam() != null && !m.getIam().isEmpty()) meta.put("iam", m.getIam());
        if (m.getCustom() != null && !m.getCustom().isEmpty()) meta.put("custom", m.getCustom());
        return meta;
    }

    /**
     * Text form sent to remote embedding models.
     */
    public static String buildText(Map<String, Object> content, Map<String, Object> metadata) {
        StringBuilder sb = new StringBuilder();
        sb.append(content.get("provider")).append(' ').append(content.get("type"));
        Object name = content.get("name");
        if (name != null && !String.valueOf(name).isBlank()) sb.append(' ').append(name);
        Object region = content.get("region");
        if (region != null && !String.valueOf(region).isBlank()) sb.append(" in ").append(region);
        sb.append(". data: ").append(CanonicalJson.write(content.get("data")));
        sb.append(". tags: ").append(CanonicalJson.write(content.get("tags")));
        if (metadata != null && !metadata.isEmpty()) {
            sb.append(". metadata: ").append(CanonicalJson.write(metadata));
        }
        return sb.toString();
    }

    /**
     * True when the two resources would be embedded from different input.
     */
    public static boolean vectorInputChanged(Resource before, Resource after) {
        String a = CanonicalJson.write(buildContent(before)) + CanonicalJson.write(buildMetadata(before));
        String b = CanonicalJson.write(buildContent(after)) + CanonicalJson.write(buildMetadata(after));
        return !a.equals(b);
    }
}
