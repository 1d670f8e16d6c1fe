package com.zzf.simon.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One pretty-printed JSON file per document under {@code <root>/<collection>/<id>.json}.
 */
@Slf4j
public class FileDocumentStore implements DocumentStore {

    private final Path root;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, ReadWriteLock> locks = new ConcurrentHashMap<>();

    public FileDocumentStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StoreException(StoreErrorCode.UNAVAILABLE, "Cannot create store directory " + root, e);
        }
        log.info("store.file.init dir={}", root.toAbsolutePath());
    }

    private ReadWriteLock getLock(Path path) {
        return locks.computeIfAbsent(path.toString(), k -> new ReentrantReadWriteLock());
    }

    @Override
    public <T> Optional<T> get(String collection, String id, Class<T> type) {
        Path target = documentPath(collection, id);
        ReadWriteLock lock = getLock(target);
        lock.readLock().lock();
        try {
            if (!Files.exists(target)) {
                return Optional.empty();
            }
            return Optional.of(read(target, type));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <T> void put(String collection, String id, T document) {
        Path target = documentPath(collection, id);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            write(target, document);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> Optional<T> update(String collection, String id, Class<T> type, UnaryOperator<T> updater) {
        Path target = documentPath(collection, id);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            if (!Files.exists(target)) {
                return Optional.empty();
            }
            T updated = updater.apply(read(target, type));
            write(target, updated);
            return Optional.of(updated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> T upsert(String collection, String id, Class<T> type, Function<Optional<T>, T> writer) {
        Path target = documentPath(collection, id);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            Optional<T> current = Files.exists(target) ? Optional.of(read(target, type)) : Optional.empty();
            T stored = writer.apply(current);
            write(target, stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String collection, String id) {
        Path target = documentPath(collection, id);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new StoreException(StoreErrorCode.UNAVAILABLE, "Failed to delete " + target, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> List<T> list(String collection, Class<T> type) {
        Path dir = collectionPath(collection);
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(".json")).collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreException(StoreErrorCode.UNAVAILABLE, "Failed to list " + dir, e);
        }
        List<T> out = new ArrayList<>();
        for (Path file : files) {
            ReadWriteLock lock = getLock(file);
            lock.readLock().lock();
            try {
                out.add(read(file, type));
            } catch (StoreException e) {
                if (e.getCode() != StoreErrorCode.NOT_FOUND) {
                    throw e;
                }
                // deleted between list and read
            } finally {
                lock.readLock().unlock();
            }
        }
        return out;
    }

    private <T> T read(Path target, Class<T> type) {
        try {
            return objectMapper.readValue(target.toFile(), type);
        } catch (NoSuchFileException e) {
            throw new StoreException(StoreErrorCode.NOT_FOUND, "Missing " + target, e);
        } catch (IOException e) {
            if (!Files.exists(target)) {
                throw new StoreException(StoreErrorCode.NOT_FOUND, "Missing " + target, e);
            }
            throw new StoreException(StoreErrorCode.INTERNAL, "Failed to read " + target, e);
        }
    }

    private void write(Path target, Object document) {
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreException(StoreErrorCode.UNAVAILABLE, "Failed to write " + target, e);
        }
    }

    private Path collectionPath(String collection) {
        Path dir = root;
        for (String part : collection.split("/")) {
            if (!part.isEmpty()) {
                dir = dir.resolve(sanitize(part));
            }
        }
        return dir;
    }

    private Path documentPath(String collection, String id) {
        if (id == null || id.isBlank()) {
            throw new StoreException(StoreErrorCode.INVALID_ARGUMENT, "Document id must not be blank");
        }
        return collectionPath(collection).resolve(sanitize(id) + ".json");
    }

    static String sanitize(String part) {
        StringBuilder sb = new StringBuilder(part.length());
        for (char c : part.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.') {
                sb.append(c);
            } else {
                sb.append('~').append(String.format("%04x", (int) c));
            }
        }
        String out = sb.toString();
        if (out.equals(".") || out.equals("..")) {
            return out.replace(".", "~002e");
        }
        return out;
    }
}
