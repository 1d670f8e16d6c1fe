package com.zzf.simon.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Keeps documents as JSON trees so callers never share mutable instances with the store.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final ObjectMapper objectMapper;
    private final Map<String, Map<String, JsonNode>> collections = new ConcurrentHashMap<>();

    public InMemoryDocumentStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Optional<T> get(String collection, String id, Class<T> type) {
        JsonNode node = collection(collection).get(id);
        return node == null ? Optional.empty() : Optional.of(convert(node, type));
    }

    @Override
    public <T> void put(String collection, String id, T document) {
        collection(collection).put(id, objectMapper.valueToTree(document));
    }

    @Override
    public <T> Optional<T> update(String collection, String id, Class<T> type, UnaryOperator<T> updater) {
        JsonNode updated = collection(collection).computeIfPresent(id,
                (key, current) -> objectMapper.valueToTree(updater.apply(convert(current, type))));
        return updated == null ? Optional.empty() : Optional.of(convert(updated, type));
    }

    @Override
    public <T> T upsert(String collection, String id, Class<T> type, Function<Optional<T>, T> writer) {
        JsonNode stored = collection(collection).compute(id, (key, current) -> objectMapper.valueToTree(
                writer.apply(current == null ? Optional.empty() : Optional.of(convert(current, type)))));
        return convert(stored, type);
    }

    @Override
    public boolean delete(String collection, String id) {
        return collection(collection).remove(id) != null;
    }

    @Override
    public <T> List<T> list(String collection, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (JsonNode node : collection(collection).values()) {
            out.add(convert(node, type));
        }
        return out;
    }

    private Map<String, JsonNode> collection(String name) {
        return collections.computeIfAbsent(name, k -> new ConcurrentHashMap<>());
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node.deepCopy(), type);
        } catch (Exception e) {
            throw new StoreException(StoreErrorCode.INVALID_ARGUMENT, "Failed to decode document as " + type.getSimpleName(), e);
        }
    }
}
