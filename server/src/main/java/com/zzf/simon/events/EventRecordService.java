package com.zzf.simon.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.api.ApiException;
import com.zzf.simon.id.Timestamps;
import com.zzf.simon.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Records of device-side effects, keyed by the tool input's idempotency key so a retried write overwrites
 * instead of duplicating.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventRecordService {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;
    static final String STATUS_COMPLETED = "completed";
    static final String STATUS_CANCELLED = "cancelled";

    private final DocumentStore store;

    public List<ObjectNode> list(String uid, EventRecordType type, String coachId, String status, Integer limit, Integer offset) {
        int max = limit == null ? DEFAULT_LIMIT : limit;
        int skip = offset == null ? 0 : offset;
        if (max < 1 || max > MAX_LIMIT) {
            throw ApiException.validation("INVALID_LIMIT", "limit must be between 1 and " + MAX_LIMIT);
        }
        if (skip < 0) {
            throw ApiException.validation("INVALID_OFFSET", "offset must be >= 0");
        }
        Comparator<ObjectNode> order = Comparator.comparing(
                (ObjectNode n) -> Timestamps.parseOrEpoch(n.path(type.orderField()).asText(null)));
        if (!type.ascending()) {
            order = order.reversed();
        }
        order = order.thenComparing(n -> n.path("id").asText(""));
        return store.list(type.collection(), ObjectNode.class).stream()
                .filter(n -> uid.equals(n.path("uid").asText()))
                .filter(n -> isBlank(coachId) || coachId.equals(n.path("coach_id").asText()))
                .filter(n -> isBlank(status) || status.equals(n.path("status").asText()))
                .sorted(order)
                .skip(skip)
                .limit(max)
                .collect(Collectors.toList());
    }

    /**
     * Creates or overwrites the record {@code id} for the caller. The first {@code created_at} survives overwrites.
     */
    public ObjectNode upsert(String uid, EventRecordType type, String id, JsonNode body) {
        if (isBlank(id)) {
            throw ApiException.validation("INVALID_ID", "record id is required");
        }
        if (body == null || !body.isObject()) {
            throw ApiException.validation("INVALID_REQUEST", "record body must be an object");
        }
        ObjectNode incoming = body.deepCopy();
        String now = Timestamps.now();
        incoming.put("id", id);
        incoming.put("uid", uid);
        incoming.put("updated_at", now);

        ObjectNode saved = store.upsert(type.collection(), id, ObjectNode.class, existing -> {
            JsonNode createdAt = null;
            if (existing.isPresent()) {
                requireOwner(uid, existing.get());
                createdAt = existing.get().get("created_at");
            }
            if (createdAt != null && !createdAt.isNull()) {
                incoming.set("created_at", createdAt);
            } else if (!incoming.hasNonNull("created_at")) {
                incoming.put("created_at", now);
            }
            return incoming;
        });
        log.info("events.upsert kind={} id={} uid={}", type.path(), id, uid);
        return saved;
    }

    /**
     * Idempotent: an already completed reminder is returned unchanged.
     */
    public ObjectNode completeReminder(String uid, String id) {
        return terminate(uid, EventRecordType.REMINDERS, id, STATUS_COMPLETED, "completed_at");
    }

    public ObjectNode cancelNotification(String uid, String id) {
        return terminate(uid, EventRecordType.NOTIFICATIONS, id, STATUS_CANCELLED, "cancelled_at");
    }

    private ObjectNode terminate(String uid, EventRecordType type, String id, String status, String stampField) {
        ObjectNode result = store.update(type.collection(), id, ObjectNode.class, record -> {
            requireOwner(uid, record);
            if (status.equals(record.path("status").asText())) {
                return record;
            }
            String now = Timestamps.now();
            record.put("status", status);
            record.put(stampField, now);
            record.put("updated_at", now);
            return record;
        }).orElseThrow(() -> ApiException.notFound("EVENT_NOT_FOUND", type.path() + " record not found"));
        log.info("events.{} id={} uid={}", status, id, uid);
        return result;
    }

    private static void requireOwner(String uid, JsonNode record) {
        if (!uid.equals(record.path("uid").asText())) {
            throw ApiException.forbidden("ACCESS_DENIED", "access denied");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
