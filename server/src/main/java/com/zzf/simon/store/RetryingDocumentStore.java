package com.zzf.simon.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

public class RetryingDocumentStore implements DocumentStore {

    private final DocumentStore delegate;
    private final RetryPolicy retryPolicy;

    public RetryingDocumentStore(DocumentStore delegate, RetryPolicy retryPolicy) {
        this.delegate = delegate;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public <T> Optional<T> get(String collection, String id, Class<T> type) {
        return retryPolicy.execute("get " + collection, () -> delegate.get(collection, id, type));
    }

    @Override
    public <T> void put(String collection, String id, T document) {
        retryPolicy.execute("put " + collection, () -> {
            delegate.put(collection, id, document);
            return null;
        });
    }

    @Override
    public <T> Optional<T> update(String collection, String id, Class<T> type, UnaryOperator<T> updater) {
        return retryPolicy.execute("update " + collection, () -> delegate.update(collection, id, type, updater));
    }

    @Override
    public <T> T upsert(String collection, String id, Class<T> type, Function<Optional<T>, T> writer) {
        return retryPolicy.execute("upsert " + collection, () -> delegate.upsert(collection, id, type, writer));
    }

    @Override
    public boolean delete(String collection, String id) {
        return retryPolicy.execute("delete " + collection, () -> delegate.delete(collection, id));
    }

    @Override
    public <T> List<T> list(String collection, Class<T> type) {
        return retryPolicy.execute("list " + collection, () -> delegate.list(collection, type));
    }
}
