package com.zzf.simon.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Collection/document storage. Every call is a single atomic document operation.
 * Collection names may contain {@code /} to express parent keys, e.g. {@code messages/<session>}.
 */
public interface DocumentStore {

    <T> Optional<T> get(String collection, String id, Class<T> type);

    /**
     * Creates or overwrites the document with this id.
     */
    <T> void put(String collection, String id, T document);

    /**
     * Read-modify-write under the document's write lock. Exceptions thrown by the updater abort the write
     * and propagate unchanged.
     *
     * @return the stored result, or empty when no document has this id
     */
    <T> Optional<T> update(String collection, String id, Class<T> type, UnaryOperator<T> updater);

    /**
     * Create-or-update under the document's write lock. The writer sees the current document, or empty when
     * none exists, and returns the document to store. Exceptions thrown by the writer abort the write.
     *
     * @return the stored document
     */
    <T> T upsert(String collection, String id, Class<T> type, Function<Optional<T>, T> writer);

    boolean delete(String collection, String id);

    <T> List<T> list(String collection, Class<T> type);
}
