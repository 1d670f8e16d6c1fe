package com.zzf.simon.tool.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.id.Identifier;
import com.zzf.simon.id.Timestamps;
import com.zzf.simon.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-user commitments and preferences used as coaching context.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryService {
    static final String COLLECTION = "memory";
    private static final int DEFAULT_LIMIT = 10;
    private static final double COMMITMENT_SCORE = 0.7;
    private static final double PREFERENCE_SCORE = 0.6;

    private final DocumentStore store;

    public UserMemory load(String uid) {
        return store.get(COLLECTION, uid, UserMemory.class)
                .orElseGet(() -> UserMemory.builder().uid(uid).build());
    }

    /**
     * Case-insensitive substring search. Output {@code {hits:[{type,id,snippet,score}]}}.
     */
    public ObjectNode read(String uid, String query, int limit) {
        int max = limit > 0 ? limit : DEFAULT_LIMIT;
        String needle = query.toLowerCase(Locale.ROOT);
        UserMemory memory = load(uid);
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ArrayNode hits = result.putArray("hits");
        for (UserMemory.Commitment commitment : memory.getCommitments()) {
            if (hits.size() >= max) {
                return result;
            }
            if (commitment.getText() != null && commitment.getText().toLowerCase(Locale.ROOT).contains(needle)) {
                addHit(hits, "commitment", commitment.getId(), commitment.getText(), COMMITMENT_SCORE);
            }
        }
        for (Map.Entry<String, JsonNode> preference : memory.getPreferences().entrySet()) {
            if (hits.size() >= max) {
                return result;
            }
            String snippet = preference.getValue().isTextual() ? preference.getValue().asText() : preference.getValue().toString();
            if (preference.getKey().toLowerCase(Locale.ROOT).contains(needle)
                    || snippet.toLowerCase(Locale.ROOT).contains(needle)) {
                addHit(hits, "preference", preference.getKey(), snippet, PREFERENCE_SCORE);
            }
        }
        return result;
    }

    /**
     * Applies {@code commitments_add}, {@code preferences_set} and {@code redactions}.
     *
     * @throws ToolFailure when a new commitment contains sensitive content
     */
    public ObjectNode write(String uid, JsonNode patch) {
        List<UserMemory.Commitment> additions = new ArrayList<>();
        for (JsonNode item : patch.path("commitments_add")) {
            String text = item.path("text").asText("");
            Optional<String> sensitive = SensitiveContent.findIn(text);
            if (sensitive.isPresent()) {
                log.info("memory.write.rejected uid={} reason={}", uid, sensitive.get());
                throw new ToolFailure("rejected: contains " + sensitive.get());
            }
            String now = Timestamps.now();
            additions.add(UserMemory.Commitment.builder()
                    .id(Identifier.ascending("commit"))
                    .text(text)
                    .dueIso(item.hasNonNull("due_iso") ? item.get("due_iso").asText() : null)
                    .status("active")
                    .createdAt(now)
                    .build());
        }
        Set<String> redactions = new HashSet<>();
        for (JsonNode redaction : patch.path("redactions")) {
            redactions.add(redaction.asText());
        }
        JsonNode preferencesSet = patch.path("preferences_set");

        UserMemory updated = store.upsert(COLLECTION, uid, UserMemory.class, current -> {
            UserMemory memory = current.orElseGet(() -> UserMemory.builder().uid(uid).build());
            memory.getCommitments().addAll(additions);
            Iterator<Map.Entry<String, JsonNode>> it = preferencesSet.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                memory.getPreferences().put(entry.getKey(), entry.getValue());
            }
            memory.getPreferences().keySet().removeAll(redactions);
            memory.getCommitments().removeIf(c -> redactions.contains(c.getId()));
            memory.setUpdatedAt(Timestamps.now());
            return memory;
        });

        log.info("memory.write uid={} added={} redacted={}", uid, additions.size(), redactions.size());
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("status", "updated");
        result.put("commitments", updated.getCommitments().size());
        ArrayNode added = result.putArray("added_ids");
        additions.forEach(c -> added.add(c.getId()));
        return result;
    }

    private static void addHit(ArrayNode hits, String type, String id, String snippet, double score) {
        ObjectNode hit = hits.addObject();
        hit.put("type", type);
        hit.put("id", id);
        hit.put("snippet", snippet);
        hit.put("score", score);
    }
}
