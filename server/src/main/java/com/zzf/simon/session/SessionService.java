package com.zzf.simon.session;

import com.zzf.simon.api.ApiException;
import com.zzf.simon.id.Identifier;
import com.zzf.simon.id.Timestamps;
import com.zzf.simon.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {
    static final String SESSIONS = "sessions";
    private static final String MESSAGES_PREFIX = "messages/";
    private static final String DEFAULT_TITLE = "New conversation";

    private final DocumentStore store;

    public Session create(String uid, String coachId, String title) {
        String now = Timestamps.now();
        Session session = Session.builder()
                .id(Identifier.random("session"))
                .uid(uid)
                .coachId(coachId == null || coachId.isBlank() ? null : coachId)
                .title(title == null || title.isBlank() ? DEFAULT_TITLE : title.trim())
                .createdAt(now)
                .updatedAt(now)
                .build();
        store.put(SESSIONS, session.getId(), session);
        log.info("session.create id={} coach={}", session.getId(), session.getCoachId());
        return session;
    }

    public Optional<Session> get(String sessionId) {
        return store.get(SESSIONS, sessionId, Session.class);
    }

    /**
     * @throws ApiException 404 when absent, 403 when owned by another user
     */
    public Session requireOwned(String uid, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw ApiException.validation("INVALID_SESSION_ID", "session id is required");
        }
        Session session = get(sessionId)
                .orElseThrow(() -> ApiException.notFound("SESSION_NOT_FOUND", "session not found"));
        if (!session.getUid().equals(uid)) {
            throw ApiException.forbidden("ACCESS_DENIED", "access denied");
        }
        return session;
    }

    public Message appendMessage(String sessionId, String role, String text) {
        Message message = Message.builder()
                .id(Identifier.ascending("msg"))
                .sessionId(sessionId)
                .role(role)
                .contentText(text)
                .createdAt(Timestamps.now())
                .build();
        store.put(MESSAGES_PREFIX + sessionId, message.getId(), message);
        return message;
    }

    /**
     * Advisory timestamp; concurrent turns race and the last write wins.
     */
    public void touch(String sessionId) {
        store.update(SESSIONS, sessionId, Session.class, s -> {
            s.setUpdatedAt(Timestamps.now());
            return s;
        });
    }

    public List<Message> getMessages(String sessionId) {
        return store.list(MESSAGES_PREFIX + sessionId, Message.class).stream()
                .sorted(Comparator.comparing((Message m) -> Timestamps.parseOrEpoch(m.getCreatedAt()))
                        .thenComparingLong(m -> sequenceOf(m.getId())))
                .collect(Collectors.toList());
    }

    private static long sequenceOf(String id) {
        if (id == null) {
            return 0;
        }
        int idx = id.lastIndexOf('_');
        try {
            return Long.parseLong(idx < 0 ? id : id.substring(idx + 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
