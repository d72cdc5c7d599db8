package com.wshg.catalog.validation;

import com.wshg.catalog.config.CatalogProperties;
import com.wshg.catalog.error.ValidationException;
import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.ResourceFilter;
import com.wshg.catalog.model.ResourceLink;
import com.wshg.catalog.model.ResourceSchema;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural checks run before a resource touches storage.
 *
 * <p>No I/O: the applicable schema is looked up by the caller and passed in, so the same
 * input always yields the same outcome.</p>
 */
@Component
public class ResourceValidator {

    private final Set<String> allowedProviders;

    @Autowired
    public ResourceValidator(CatalogProperties props) {
        this(props.getAllowedProviders());
    }

    public ResourceValidator(Collection<String> allowedProviders) {
        this.allowedProviders = allowedProviders == null ? Set.of() : Set.copyOf(new TreeSet<>(allowedProviders));
    }

    /**
     * @param schema registered schema for the resource's (provider, type), or null if none
     * @throws ValidationException on the first violated rule
     */
    public void validate(Resource resource, ResourceSchema schema) {
        if (resource == null) throw ValidationException.missingField("resource");
        requireText("id", resource.getId());
        requireText("type", resource.getType());
        requireText("provider", resource.getProvider());

        if (!allowedProviders.isEmpty() && !allowedProviders.contains(resource.getProvider())) {
            throw ValidationException.invalidValue("provider",
                    "unsupported provider: " + resource.getProvider() + ", expected one of " + allowedProviders);
        }

        if (schema != null && schema.getRequiredFields() != null) {
            Map<String, Object> data = resource.getData();
            for (String field : schema.getRequiredFields()) {
                if (data == null || !data.containsKey(field)) {
                    throw ValidationException.schemaMismatch(field, schema.getProvider(), schema.getType());
                }
            }
        }

        checkTags("tags", resource.getTags());

        if (resource.hasParent() && resource.getParentId().equals(resource.getId())) {
            throw ValidationException.invalidValue("parentId", "resource cannot be its own parent");
        }
        if (resource.getChildren() != null && resource.getChildren().contains(resource.getId())) {
            throw ValidationException.invalidValue("children", "resource cannot be its own child");
        }
        if (resource.getLinks() != null) {
            for (ResourceLink link : resource.getLinks()) {
                if (link == null || link.getTargetId() == null || link.getTargetId().isBlank()) {
                    throw ValidationException.missingField("links.targetId");
                }
            }
        }
    }

    /**
     * Checks a schema before it is registered.
     */
    public void validateSchema(ResourceSchema schema) {
        if (schema == null) throw ValidationException.missingField("schema");
        requireText("provider", schema.getProvider());
        requireText("type", schema.getType());
        requireText("version", schema.getVersion());
        if (schema.getRequiredFields() != null) {
            for (String field : schema.getRequiredFields()) {
                if (field == null || field.isBlank()) {
                    throw ValidationException.invalidValue("requiredFields", "required field names must not be blank");
                }
            }
        }
    }

    /**
     * Filter tags are matched by value, so a null value can never match.
     */
    public void validateFilter(ResourceFilter filter) {
        if (filter != null) checkTags("filter.tags", filter.getTags());
    }

    private static void checkTags(String field, Map<String, String> tags) {
        if (tags == null) return;
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            if (tag.getKey() == null || tag.getKey().isBlank()) {
                throw ValidationException.invalidValue(field, "tag keys must not be blank");
            }
            if (tag.getValue() == null) {
                throw ValidationException.invalidValue(field, "tag " + tag.getKey() + " has a null value");
            }
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) throw ValidationException.missingField(field);
    }
}
