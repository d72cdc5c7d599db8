package com.wshg.catalog.validation;

import com.wshg.catalog.error.ValidationException;
import com.wshg.catalog.model.Resource;
import com.wshg.catalog.model.ResourceFilter;
import com.wshg.catalog.model.ResourceLink;
import com.wshg.catalog.model.ResourceSchema;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceValidatorTest {

    private final ResourceValidator validator = new ResourceValidator(List.of());

    private static Resource vm() {
        return Resource.builder()
                .id("r1")
                .type("vm")
                .provider("aws")
                .data(new java.util.LinkedHashMap<>(Map.of("size", "t3.micro")))
                .build();
    }

    private static ResourceSchema vmSchema(String... required) {
        return ResourceSchema.builder()
                .provider("aws")
                .type("vm")
                .version("1")
                .requiredFields(List.of(required))
                .build();
    }

    @Test
    void acceptsMinimalResource() {
        assertDoesNotThrow(() -> validator.validate(vm(), null));
    }

    @Test
    void rejectsBlankIdentityFields() {
        for (String field : List.of("id", "type", "provider")) {
            Resource r = vm();
            switch (field) {
                case "id": r.setId(" "); break;
                case "type": r.setType(""); break;
                default: r.setProvider(null);
            }
            ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(r, null));
            assertEquals(ValidationException.Reason.MISSING_FIELD, ex.getReason());
            assertEquals(field, ex.getField());
            assertEquals(field, ex.getDetails().get("field"));
        }
    }

    @Test
    void schemaRequiredFieldMustBePresentInData() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(vm(), vmSchema("size", "ami")));
        assertEquals(ValidationException.Reason.SCHEMA_MISMATCH, ex.getReason());
        assertEquals("ami", ex.getField());

        assertDoesNotThrow(() -> validator.validate(vm(), vmSchema("size")));
    }

    @Test
    void restrictsProvidersWhenConfigured() {
        ResourceValidator restricted = new ResourceValidator(List.of("aws", "gcp"));
        Resource r = vm();
        r.setProvider("oracle");
        ValidationException ex = assertThrows(ValidationException.class, () -> restricted.validate(r, null));
        assertEquals(ValidationException.Reason.INVALID_VALUE, ex.getReason());
        assertEquals("provider", ex.getField());
    }

    @Test
    void rejectsSelfReferencesAndLinksWithoutTarget() {
        Resource selfParent = vm();
        selfParent.setParentId("r1");
        assertEquals("parentId", assertThrows(ValidationException.class,
                () -> validator.validate(selfParent, null)).getField());

        Resource badLink = vm();
        badLink.setLinks(List.of(ResourceLink.builder().type("attached-to").build()));
        assertEquals("links.targetId", assertThrows(ValidationException.class,
                () -> validator.validate(badLink, null)).getField());
    }

    @Test
    void rejectsNullTagValuesButAllowsEmptyOnes() {
        Resource nullValue = vm();
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("env", null);
        nullValue.setTags(tags);
        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(nullValue, null));
        assertEquals(ValidationException.Reason.INVALID_VALUE, ex.getReason());
        assertEquals("tags", ex.getField());

        Resource emptyValue = vm();
        emptyValue.setTags(new LinkedHashMap<>(Map.of("env", "")));
        assertDoesNotThrow(() -> validator.validate(emptyValue, null));
    }

    @Test
    void filterTagsMustHaveValues() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("env", null);
        ResourceFilter filter = ResourceFilter.builder().tags(tags).build();
        assertEquals("filter.tags", assertThrows(ValidationException.class,
                () -> validator.validateFilter(filter)).getField());

        assertDoesNotThrow(() -> validator.validateFilter(null));
        assertDoesNotThrow(() -> validator.validateFilter(ResourceFilter.builder().tags(Map.of("env", "prod")).build()));
    }

    @Test
    void validationHasNoSideEffects() {
        Resource r = vm();
        Resource before = r.copy();
        ResourceSchema schema = vmSchema("missing");

        ValidationException first = assertThrows(ValidationException.class, () -> validator.validate(r, schema));
        ValidationException second = assertThrows(ValidationException.class, () -> validator.validate(r, schema));

        assertEquals(first.getMessage(), second.getMessage());
        assertEquals(first.getDetails(), second.getDetails());
        assertEquals(before, r);
    }

    @Test
    void schemaNeedsVersion() {
        ResourceSchema schema = vmSchema("size");
        schema.setVersion(null);
        assertEquals("version", assertThrows(ValidationException.class,
                () -> validator.validateSchema(schema)).getField());
    }
}
