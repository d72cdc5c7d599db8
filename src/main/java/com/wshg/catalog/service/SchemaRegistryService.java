package com.wshg.catalog.service;

import com.wshg.catalog.entity.ResourceSchemaEntity;
import com.wshg.catalog.error.PersistenceException;
import com.wshg.catalog.error.SchemaNotFoundException;
import com.wshg.catalog.model.ResourceSchema;
import com.wshg.catalog.repository.ResourceSchemaRepository;
import com.wshg.catalog.store.ResourceMapper;
import com.wshg.catalog.validation.ResourceValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registered (provider, type) schemas. The validator receives a snapshot of the matching schema;
 * it never reads this registry itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaRegistryService {

    private final ResourceSchemaRepository repository;
    private final ResourceMapper mapper;
    private final ResourceValidator validator;

    /**
     * Creates the schema or replaces the one registered for the same (provider, type).
     */
    @Transactional
    public ResourceSchema register(ResourceSchema schema) {
        validator.validateSchema(schema);
        try {
            ResourceSchemaEntity e = repository.findByProviderAndType(schema.getProvider(), schema.getType())
                    .orElseGet(ResourceSchemaEntity::new);
            boolean created = e.getId() == null;
            e.setProvider(schema.getProvider());
            e.setType(schema.getType());
            e.setVersion(schema.getVersion());
            e.setRequiredJson(mapper.write(schema.getRequiredFields() != null ? schema.getRequiredFields() : List.of()));
            e.setPropertiesJson(schema.getProperties() != null ? mapper.write(schema.getProperties()) : null);
            e.setDescription(schema.getDescription());
            ResourceSchema saved = toSchema(repository.saveAndFlush(e));
            log.info("[Schema] {} {}/{} version={}", created ? "registered" : "replaced",
                    saved.getProvider(), saved.getType(), saved.getVersion());
            return saved;
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to register schema " + schema.getProvider() + "/" + schema.getType(), ex);
        }
    }

    @Transactional(readOnly = true)
    public Optional<ResourceSchema> find(String provider, String type) {
        if (provider == null || type == null) return Optional.empty();
        try {
            return repository.findByProviderAndType(provider, type).map(this::toSchema);
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to read schema " + provider + "/" + type, ex);
        }
    }

    public ResourceSchema get(String provider, String type) {
        return find(provider, type).orElseThrow(() -> new SchemaNotFoundException(provider, type));
    }

    /**
     * @param provider optional provider filter
     */
    @Transactional(readOnly = true)
    public List<ResourceSchema> list(String provider) {
        try {
            List<ResourceSchemaEntity> rows = provider == null || provider.isBlank()
                    ? repository.findAllByOrderByProviderAscTypeAsc()
                    : repository.findByProviderOrderByTypeAsc(provider);
            return rows.stream().map(this::toSchema).collect(Collectors.toList());
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to list schemas", ex);
        }
    }

    @Transactional
    public void delete(String provider, String type) {
        ResourceSchemaEntity e;
        try {
            e = repository.findByProviderAndType(provider, type).orElse(null);
            if (e != null) repository.delete(e);
        } catch (DataAccessException ex) {
            throw new PersistenceException("failed to delete schema " + provider + "/" + type, ex);
        }
        if (e == null) throw new SchemaNotFoundException(provider, type);
        log.info("[Schema] deleted {}/{}", provider, type);
    }

    private ResourceSchema toSchema(ResourceSchemaEntity e) {
        return ResourceSchema.builder()
                .provider(e.getProvider())
                .type(e.getType())
                .version(e.getVersion())
                .requiredFields(new ArrayList<>(mapper.readStringList(e.getRequiredJson())))
                .properties(e.getPropertiesJson() != null ? mapper.readMap(e.getPropertiesJson()) : null)
                .description(e.getDescription())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .build();
    }
}
