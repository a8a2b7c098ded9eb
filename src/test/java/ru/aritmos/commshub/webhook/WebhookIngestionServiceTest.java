package ru.aritmos.commshub.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.commshub.collab.AuditSink;
import ru.aritmos.commshub.collab.JdbcOrganizationDirectory;
import ru.aritmos.commshub.collab.JdbcRetentionPolicyDirectory;
import ru.aritmos.commshub.config.WebhookSettings;
import ru.aritmos.commshub.core.AuthenticationException;
import ru.aritmos.commshub.model.CallLog;
import ru.aritmos.commshub.model.CallState;
import ru.aritmos.commshub.model.SystemActor;
import ru.aritmos.commshub.store.CallAggregateRepository;
import ru.aritmos.commshub.store.CallEventStore;
import ru.aritmos.commshub.store.RecordingRepository;
import ru.aritmos.commshub.support.RecordingAuditSink;
import ru.aritmos.commshub.support.TestDatabase;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookIngestionServiceTest {

    private TestDatabase db;
    private CallAggregateRepository calls;
    private RecordingAuditSink audit;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        calls = new CallAggregateRepository(db.dataSource(), new CallEventStore(db.dataSource()),
                new RecordingRepository(db.dataSource()), new JdbcRetentionPolicyDirectory(db.dataSource()));
        audit = new RecordingAuditSink();
    }

    private WebhookIngestionService service(WebhookSettings settings, AuditSink sink) {
        return new WebhookIngestionService(settings, new WebhookSignatureVerifier(settings),
                new WebhookEventParser(new ObjectMapper()), new TelnyxEventNormalizer(),
                new JdbcOrganizationDirectory(db.dataSource()), calls, sink);
    }

    private WebhookIngestionService unsigned() {
        return service(WebhookSettings.defaults().withRequireSignature(false), audit);
    }

    private static byte[] body(String eventType, String eventId, String callId, Object orgId) {
        String org = orgId == null ? "" : ",\"org_id\":" + orgId;
        return ("{\"data\":{\"event_type\":\"" + eventType + "\",\"id\":\"" + eventId + "\"," +
                "\"occurred_at\":\"2026-03-01T10:00:00Z\",\"payload\":{\"call_control_id\":\"" + callId + "\"" + org + "}}}")
                .getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void ingest_duplicateWebhookShouldYieldOneCallAndOneEvent() {
        db.organization(1, true);
        WebhookIngestionService service = unsigned();

        WebhookIngestionService.Outcome first = service.ingest(body("call.answered", "evt-1", "call-9", 1), null, null, "corr-1");
        WebhookIngestionService.Outcome second = service.ingest(body("call.answered", "evt-1", "call-9", 1), null, null, "corr-2");

        assertEquals(WebhookIngestionService.STATUS_OK, first.status());
        assertTrue(first.accepted());
        assertTrue(first.created());
        assertFalse(second.accepted());
        assertFalse(second.created());
        assertEquals(first.callId(), second.callId());

        CallLog call = calls.findByExternalId(1, "call-9").orElseThrow();
        assertEquals(CallState.ANSWERED, call.callState());
        assertEquals(1, db.count("SELECT COUNT(*) FROM comms_call_events WHERE provider_event_id='evt-1'"));
        assertEquals(1, audit.entries.size(), "аудит пишется только для принятых событий");
        assertEquals(SystemActor.TELNYX_WEBHOOK, audit.entries.get(0).actor());
        assertEquals("create", audit.entries.get(0).action());
        assertEquals("comms.call.answered", audit.entries.get(0).eventType());
    }

    @Test
    void ingest_hangupBeforeAnswerShouldEndInEndedState() {
        db.organization(1, true);
        WebhookIngestionService service = unsigned();

        service.ingest(body("call.hangup", "evt-h", "call-9", 1), null, null, "corr-1");
        service.ingest(body("call.answered", "evt-a", "call-9", 1), null, null, "corr-2");

        assertEquals(CallState.ENDED, calls.findByExternalId(1, "call-9").orElseThrow().callState());
        assertEquals(2, db.count("SELECT COUNT(*) FROM comms_call_events"));
        assertEquals(List.of("comms.call.hangup", "comms.call.answered"), audit.eventTypes());
        assertEquals("update", audit.entries.get(1).action());
    }

    @Test
    void ingest_oversizedProviderFieldsShouldStillBeApplied() {
        db.organization(1, true);
        String longType = "call." + "x".repeat(300);
        String longCaller = "+1" + "5".repeat(500);
        byte[] payload = ("{\"data\":{\"event_type\":\"" + longType + "\",\"id\":\"evt-long\"," +
                "\"payload\":{\"call_control_id\":\"call-9\",\"org_id\":1,\"from\":\"" + longCaller + "\"}}}")
                .getBytes(StandardCharsets.UTF_8);

        WebhookIngestionService.Outcome outcome = unsigned().ingest(payload, null, null, "corr");

        assertEquals(WebhookIngestionService.STATUS_OK, outcome.status());
        assertTrue(outcome.accepted());
        CallLog call = calls.findByExternalId(1, "call-9").orElseThrow();
        assertEquals(WebhookEventParser.MAX_PARTY, call.caller().length());
        assertEquals(WebhookEventParser.MAX_EVENT_TYPE, call.lastEvent().length());
    }

    @Test
    void ingest_unknownOrganizationShouldBeSoftSkipped() {
        WebhookIngestionService.Outcome outcome = unsigned().ingest(body("call.answered", "evt-1", "call-9", 42), null, null, "corr");

        assertEquals(WebhookIngestionService.STATUS_NO_ORG, outcome.status());
        assertNull(outcome.callId());
        assertEquals(0, db.count("SELECT COUNT(*) FROM comms_call_logs"));
    }

    @Test
    void ingest_missingOrganizationShouldUseConfiguredDefault() {
        db.organization(5, true);
        WebhookIngestionService service = service(
                WebhookSettings.defaults().withRequireSignature(false).withDefaultOrgId(5L), audit);

        WebhookIngestionService.Outcome outcome = service.ingest(body("call.initiated", "evt-1", "call-9", null), null, null, "corr");

        assertEquals(WebhookIngestionService.STATUS_OK, outcome.status());
        assertTrue(calls.findByExternalId(5, "call-9").isPresent());
        assertEquals(WebhookIngestionService.STATUS_NO_ORG,
                unsigned().ingest(body("call.initiated", "evt-2", "call-9", null), null, null, "corr").status());
    }

    @Test
    void ingest_disabledModuleShouldBeSoftSkipped() {
        db.organization(1, false);

        WebhookIngestionService.Outcome outcome = unsigned().ingest(body("call.answered", "evt-1", "call-9", 1), null, null, "corr");

        assertEquals(WebhookIngestionService.STATUS_MODULE_DISABLED, outcome.status());
        assertEquals(0, db.count("SELECT COUNT(*) FROM comms_call_events"));
    }

    @Test
    void ingest_invalidSignatureShouldWriteNothing() throws Exception {
        db.organization(1, true);
        KeyPair keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        WebhookSettings settings = WebhookSettings.defaults()
                .withPublicKey(Base64.getEncoder().encodeToString(keyPair.getPublic().getEncoded()));
        WebhookIngestionService service = service(settings, audit);
        byte[] raw = body("call.answered", "evt-1", "call-9", 1);
        String signature = WebhookSignatureVerifierTest.sign(keyPair.getPrivate(), "1767261600", raw);

        assertThrows(AuthenticationException.class, () -> service.ingest(raw, signature, "1767261601", "corr"));
        assertEquals(0, db.count("SELECT COUNT(*) FROM comms_call_logs"));

        assertEquals(WebhookIngestionService.STATUS_OK, service.ingest(raw, signature, "1767261600", "corr").status());
    }

    @Test
    void ingest_invalidJsonShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> unsigned().ingest("{oops".getBytes(StandardCharsets.UTF_8), null, null, "corr"));
    }

    @Test
    void ingest_auditFailureShouldNotFailDelivery() {
        db.organization(1, true);
        AuditSink failing = (orgId, actor, action, resource, resourceId, before, after, eventType) -> {
            throw new IllegalStateException("audit down");
        };

        WebhookIngestionService.Outcome outcome = service(WebhookSettings.defaults().withRequireSignature(false), failing)
                .ingest(body("call.answered", "evt-1", "call-9", 1), null, null, "corr");

        assertEquals(WebhookIngestionService.STATUS_OK, outcome.status());
        assertEquals(1, db.count("SELECT COUNT(*) FROM comms_call_events"));
    }
}
