package ru.aritmos.commshub.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WebhookEventParserTest {

    private final WebhookEventParser parser = new WebhookEventParser(new ObjectMapper());

    private WebhookEvent parse(String json) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parse_shouldReadDataEnvelope() {
        WebhookEvent e = parse("""
                {"data":{"event_type":"call.hangup","id":"evt-1","occurred_at":"2026-03-01T10:00:00Z",
                 "payload":{"call_control_id":"call-9","from":"+15550001","to":"+15550002","duration":"42",
                            "hangup_cause":"normal_clearing","org_id":"7"}}}
                """);

        assertEquals("call.hangup", e.rawEventType());
        assertEquals("evt-1", e.providerEventId());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), e.occurredAt());
        assertEquals("call-9", e.externalCallId());
        assertEquals(7L, e.orgId());
        assertEquals("+15550001", e.caller());
        assertEquals("+15550002", e.recipient());
        assertEquals(42, e.durationSeconds());
        assertEquals("normal_clearing", e.disposition());
        assertEquals("inbound", e.direction());
    }

    @Test
    void parse_shouldClipFieldsToColumnWidth() {
        WebhookEvent e = parse("{\"data\":{\"event_type\":\"" + "t".repeat(200) + "\",\"id\":\"" + "i".repeat(400) + "\","
                + "\"payload\":{\"call_control_id\":\"call-9\",\"to\":\"" + "7".repeat(129) + "\"}}}");

        assertEquals(WebhookEventParser.MAX_EVENT_TYPE, e.rawEventType().length());
        assertEquals(WebhookEventParser.MAX_ID, e.providerEventId().length());
        assertEquals(WebhookEventParser.MAX_PARTY, e.recipient().length());
        assertEquals("call-9", e.externalCallId());
    }

    @Test
    void parse_shouldFallBackToTopLevelPayloadAndAlternativeFields() {
        WebhookEvent e = parse("""
                {"event_type":"call.recording.saved",
                 "payload":{"event_id":"evt-2","call_leg_id":"leg-1","caller":"a","recipient":"b",
                            "recording_urls":{"mp3":"https://rec/1.mp3"},"recording_id":"rec-1",
                            "metadata":{"org_id":3},"direction":"outbound","dtmf":"5"}}
                """);

        assertEquals("call.recording.saved", e.rawEventType());
        assertEquals("evt-2", e.providerEventId());
        assertEquals("leg-1", e.externalCallId());
        assertEquals(3L, e.orgId());
        assertEquals("https://rec/1.mp3", e.recordingUrl());
        assertEquals("rec-1", e.recordingId());
        assertEquals("outbound", e.direction());
        assertEquals("5", e.dtmfDigits());
        assertEquals("call.recording.saved", e.disposition(), "без hangup_cause disposition берётся из типа события");
    }

    @Test
    void parse_shouldTolerateMissingFields() {
        WebhookEvent e = parse("{}");

        assertEquals("unknown", e.rawEventType());
        assertEquals("", e.providerEventId());
        assertNull(e.occurredAt());
        assertNull(e.orgId());
        assertNull(e.durationSeconds());
    }

    @Test
    void parse_shouldRejectNonObjectBody() {
        assertThrows(IllegalArgumentException.class, () -> parse("not json"));
        assertThrows(IllegalArgumentException.class, () -> parse("[1,2]"));
    }

    @Test
    void parseInstant_shouldReturnNullForGarbage() {
        assertNull(WebhookEventParser.parseInstant("yesterday"));
        assertEquals(Instant.parse("2026-03-01T07:00:00Z"), WebhookEventParser.parseInstant("2026-03-01T10:00:00+03:00"));
    }
}
