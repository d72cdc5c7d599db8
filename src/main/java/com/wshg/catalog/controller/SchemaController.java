package com.wshg.catalog.controller;

import com.wshg.catalog.model.ResourceSchema;
import com.wshg.catalog.service.SchemaRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/schemas")
@RequiredArgsConstructor
public class SchemaController {

    private final SchemaRegistryService schemaRegistry;

    @PutMapping
    public ResourceSchema register(@RequestBody ResourceSchema schema) {
        log.info("[API] PUT /api/schemas provider={}, type={}, version={}",
                schema.getProvider(), schema.getType(), schema.getVersion());
        return schemaRegistry.register(schema);
    }

    @GetMapping
    public List<ResourceSchema> list(@RequestParam(required = false) String provider) {
        return schemaRegistry.list(provider);
    }

    @GetMapping("/{provider}/{type}")
    public ResourceSchema get(@PathVariable String provider, @PathVariable String type) {
        return schemaRegistry.get(provider, type);
    }

    @DeleteMapping("/{provider}/{type}")
    public ResponseEntity<Void> delete(@PathVariable String provider, @PathVariable String type) {
        log.info("[API] DELETE /api/schemas/{}/{}", provider, type);
        schemaRegistry.delete(provider, type);
        return ResponseEntity.noContent().build();
    }
}
