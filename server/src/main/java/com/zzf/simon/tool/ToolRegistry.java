package com.zzf.simon.tool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed catalogue of tools, loaded from {@code tools/registry.json} on the classpath.
 */
@Slf4j
@Component
public class ToolRegistry {
    static final String RESOURCE = "tools/registry.json";

    private final Map<String, ToolDefinition> tools;

    @Autowired
    public ToolRegistry(ObjectMapper objectMapper) {
        this(load(objectMapper));
    }

    ToolRegistry(List<ToolDefinition> definitions) {
        Map<String, ToolDefinition> byId = new LinkedHashMap<>();
        for (ToolDefinition def : definitions) {
            if (def.getId() == null || def.getOwner() == null || def.getSchema() == null) {
                throw new IllegalStateException("Incomplete tool definition: " + def.getId());
            }
            if (byId.put(def.getId(), def) != null) {
                throw new IllegalStateException("Duplicate tool id: " + def.getId());
            }
        }
        this.tools = Collections.unmodifiableMap(byId);
        log.info("tools.registry.loaded count={}", tools.size());
    }

    private static List<ToolDefinition> load(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(RESOURCE).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<ToolDefinition>>() {
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RESOURCE, e);
        }
    }

    public Optional<ToolDefinition> find(String toolId) {
        return Optional.ofNullable(toolId == null ? null : tools.get(toolId));
    }

    public List<ToolDefinition> list() {
        return new ArrayList<>(tools.values());
    }

    public List<ToolDefinition> listByOwner(ToolOwner owner) {
        List<ToolDefinition> out = new ArrayList<>();
        for (ToolDefinition def : tools.values()) {
            if (def.getOwner() == owner) {
                out.add(def);
            }
        }
        return out;
    }
}
