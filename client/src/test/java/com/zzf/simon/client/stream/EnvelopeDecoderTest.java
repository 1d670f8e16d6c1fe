package com.zzf.simon.client.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeDecoderTest {
    private final EnvelopeDecoder decoder = new EnvelopeDecoder(new ObjectMapper());

    @Test
    void decode_should_map_known_types() {
        StreamEvent event = decoder.decode(new SseFrame("4", "message.final",
                "{\"message_id\":\"msg_1\",\"role\":\"assistant\",\"text\":\"Done.\",\"render_hints\":{\"max_cards\":3}}")).orElseThrow();

        StreamEvent.MessageFinal message = assertInstanceOf(StreamEvent.MessageFinal.class, event);
        assertEquals(4, message.getId());
        assertEquals("msg_1", message.getMessageId());
        assertEquals("Done.", message.getText());
        assertEquals(3, message.getMaxCards());
        assertFalse(message.isTerminal());
    }

    @Test
    void decode_should_fall_back_to_unknown_for_new_types() {
        StreamEvent event = decoder.decode(new SseFrame("2", "card.habit_streak", "{\"days\":4}")).orElseThrow();

        StreamEvent.Unknown unknown = assertInstanceOf(StreamEvent.Unknown.class, event);
        assertEquals("card.habit_streak", unknown.getType());
        assertEquals(4, unknown.getData().path("days").asInt());
    }

    @Test
    void decode_should_skip_undecodable_payloads() {
        assertTrue(decoder.decode(new SseFrame("3", "message.delta", "{not json")).isEmpty());
        assertTrue(decoder.decode(new SseFrame("3", "message.delta", "[1,2]")).isEmpty());
    }

    @Test
    void tool_request_should_accept_legacy_tool_field() {
        Optional<StreamEvent> event = decoder.decode(new SseFrame("9", "tool.request",
                "{\"request_id\":\"req_1\",\"tool\":\"reminder_create\",\"requires_confirmation\":false,\"input\":{\"title\":\"Walk\"}}"));

        StreamEvent.ToolRequest request = assertInstanceOf(StreamEvent.ToolRequest.class, event.orElseThrow());
        assertEquals("reminder_create", request.getToolId());
        assertFalse(request.isRequiresConfirmation());
        assertEquals("Walk", request.getInput().path("title").asText());
    }

    @Test
    void error_and_done_should_be_terminal() {
        assertTrue(decoder.decode(new SseFrame("5", "error", "{\"code\":\"TIMEOUT\",\"message\":\"late\"}")).orElseThrow().isTerminal());
        assertTrue(decoder.decode(new SseFrame("6", "stream.done", "{\"status\":\"ok\"}")).orElseThrow().isTerminal());
    }
}
