package com.zzf.simon.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.simon.api.ApiException;
import com.zzf.simon.api.ErrorKind;
import com.zzf.simon.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SessionServiceTest {

    private SessionService sessions;

    @BeforeEach
    void setUp() {
        sessions = new SessionService(new InMemoryDocumentStore(new ObjectMapper()));
    }

    @Test
    void shouldCreateSessionWithDefaults() {
        Session session = sessions.create("alice", " ", null);

        assertTrue(session.getId().startsWith("session_"));
        assertNull(session.getCoachId());
        assertEquals("New conversation", session.getTitle());
        assertEquals(session, sessions.get(session.getId()).orElseThrow());
    }

    @Test
    void shouldEnforceOwnership() {
        Session session = sessions.create("alice", "coach_1", "Focus");

        assertEquals("Focus", sessions.requireOwned("alice", session.getId()).getTitle());
        assertEquals(ErrorKind.FORBIDDEN, assertThrows(ApiException.class, () -> sessions.requireOwned("bob", session.getId())).getKind());
        assertEquals(ErrorKind.NOT_FOUND, assertThrows(ApiException.class, () -> sessions.requireOwned("alice", "session_x")).getKind());
    }

    @Test
    void shouldReturnMessagesInWriteOrder() {
        Session session = sessions.create("alice", null, null);
        for (int i = 0; i < 5; i++) {
            sessions.appendMessage(session.getId(), i % 2 == 0 ? Message.ROLE_USER : Message.ROLE_ASSISTANT, "m" + i);
        }

        List<String> texts = sessions.getMessages(session.getId()).stream()
                .map(Message::getContentText)
                .collect(Collectors.toList());

        assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), texts);
    }
}
