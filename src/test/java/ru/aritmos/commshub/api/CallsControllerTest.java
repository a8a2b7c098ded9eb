package ru.aritmos.commshub.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Get;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.commshub.calls.CommsCallService;
import ru.aritmos.commshub.collab.JdbcLegalHoldDirectory;
import ru.aritmos.commshub.collab.JdbcRetentionPolicyDirectory;
import ru.aritmos.commshub.config.CommsHubProperties;
import ru.aritmos.commshub.config.CommsSecurityProperties;
import ru.aritmos.commshub.config.PolicySettings;
import ru.aritmos.commshub.model.CallCreateRequest;
import ru.aritmos.commshub.model.CallLog;
import ru.aritmos.commshub.model.CallState;
import ru.aritmos.commshub.model.SystemActor;
import ru.aritmos.commshub.policy.CommsPolicyRules;
import ru.aritmos.commshub.policy.LegalHoldGuard;
import ru.aritmos.commshub.security.TenantResolver;
import ru.aritmos.commshub.store.CallAggregateRepository;
import ru.aritmos.commshub.store.CallEventStore;
import ru.aritmos.commshub.store.RecordingRepository;
import ru.aritmos.commshub.store.TranscriptRepository;
import ru.aritmos.commshub.support.RecordingAuditSink;
import ru.aritmos.commshub.support.TestDatabase;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CallsControllerTest {

    private TestDatabase db;
    private CommsCallService service;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        JdbcRetentionPolicyDirectory retention = new JdbcRetentionPolicyDirectory(db.dataSource());
        CallEventStore events = new CallEventStore(db.dataSource());
        RecordingRepository recordings = new RecordingRepository(db.dataSource());
        service = new CommsCallService(new CallAggregateRepository(db.dataSource(), events, recordings, retention),
                events, recordings, new TranscriptRepository(db.dataSource()), retention,
                key -> new byte[0], new LegalHoldGuard(new JdbcLegalHoldDirectory(db.dataSource())),
                new CommsPolicyRules(PolicySettings.defaults()), new RecordingAuditSink(), new ObjectMapper(),
                new CommsHubProperties());
    }

    private CallsController controller(CommsSecurityProperties.Mode mode) {
        CommsSecurityProperties props = new CommsSecurityProperties();
        props.setMode(mode);
        return new CallsController(service, new TenantResolver(props));
    }

    @Test
    void initiateOutbound_shouldAnswerCreated() {
        HttpResponse<?> response = controller(CommsSecurityProperties.Mode.OPEN).initiateOutbound(
                new CallCreateRequest("+15550001", "+15550002", null, null, null, null, "call-out-1"),
                HttpRequest.POST("/api/comms/calls/outbound", "").header(TenantResolver.ORG_HEADER, "1"));

        assertEquals(HttpStatus.CREATED, response.getStatus());
        CallLog body = (CallLog) response.getBody().orElseThrow();
        assertEquals(CallState.INITIATED, body.callState());
        assertEquals(1L, body.orgId());
    }

    @Test
    void create_shouldRejectRequestWithoutParties() {
        HttpResponse<?> response = controller(CommsSecurityProperties.Mode.OPEN).create(
                new CallCreateRequest(null, null, null, null, null, null, null),
                HttpRequest.POST("/api/comms/calls", "").header(TenantResolver.ORG_HEADER, "1"));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatus());
        assertEquals(0, db.count("SELECT COUNT(*) FROM comms_call_logs"));
    }

    @Test
    void keycloakMode_shouldNotTrustOrgHeaderWithoutUser() {
        service.createCall(2L, SystemActor.user("u-2"), new CallCreateRequest("a", "b", null, null, null, null, "call-2"));

        HttpResponse<?> response = controller(CommsSecurityProperties.Mode.KEYCLOAK_REQUIRED)
                .list(null, HttpRequest.GET("/api/comms/calls").header(TenantResolver.ORG_HEADER, "2"));

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatus());
    }

    @Test
    void timeline_shouldBeNestedUnderCall() throws NoSuchMethodException {
        Get mapping = CallsController.class.getMethod("timeline", String.class, HttpRequest.class).getAnnotation(Get.class);

        assertEquals("/calls/{externalCallId}/timeline", mapping.uri());
    }
}
