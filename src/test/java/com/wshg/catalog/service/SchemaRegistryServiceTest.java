package com.wshg.catalog.service;

import com.wshg.catalog.error.SchemaNotFoundException;
import com.wshg.catalog.error.ValidationException;
import com.wshg.catalog.model.ResourceSchema;
import com.wshg.catalog.repository.ResourceSchemaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SchemaRegistryServiceTest {

    @Autowired
    private SchemaRegistryService registry;
    @Autowired
    private ResourceSchemaRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    private static ResourceSchema schema(String provider, String type, String version, String... required) {
        return ResourceSchema.builder()
                .provider(provider).type(type).version(version)
                .requiredFields(List.of(required))
                .properties(Map.of("size", Map.of("type", "string")))
                .build();
    }

    @Test
    void registerThenReplaceKeepsOneSchemaPerProviderAndType() {
        registry.register(schema("aws", "vm", "1", "size"));
        ResourceSchema replaced = registry.register(schema("aws", "vm", "2", "size", "ami"));

        assertEquals("2", replaced.getVersion());
        assertEquals(1, repository.count());
        ResourceSchema loaded = registry.get("aws", "vm");
        assertEquals(List.of("size", "ami"), loaded.getRequiredFields());
        assertNotNull(loaded.getCreatedAt());
    }

    @Test
    void listsSortedAndByProvider() {
        registry.register(schema("gcp", "vm", "1"));
        registry.register(schema("aws", "vm", "1"));
        registry.register(schema("aws", "bucket", "1"));

        assertEquals(List.of("aws/bucket", "aws/vm", "gcp/vm"), keys(registry.list(null)));
        assertEquals(List.of("aws/bucket", "aws/vm"), keys(registry.list("aws")));
    }

    @Test
    void deleteAndMissingSchema() {
        registry.register(schema("aws", "vm", "1"));
        registry.delete("aws", "vm");

        assertTrue(registry.find("aws", "vm").isEmpty());
        assertThrows(SchemaNotFoundException.class, () -> registry.get("aws", "vm"));
        assertThrows(SchemaNotFoundException.class, () -> registry.delete("aws", "vm"));
    }

    @Test
    void rejectsIncompleteSchema() {
        assertThrows(ValidationException.class, () -> registry.register(schema("aws", "vm", " ")));
        assertEquals(0, repository.count());
    }

    private static List<String> keys(List<ResourceSchema> schemas) {
        return schemas.stream().map(s -> s.getProvider() + "/" + s.getType()).collect(Collectors.toList());
    }
}
