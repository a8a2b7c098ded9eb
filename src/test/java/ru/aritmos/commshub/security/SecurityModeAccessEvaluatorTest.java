package ru.aritmos.commshub.security;

import org.junit.jupiter.api.Test;
import ru.aritmos.commshub.config.CommsSecurityProperties;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SecurityModeAccessEvaluatorTest {

    private final SecurityModeAccessEvaluator evaluator = new SecurityModeAccessEvaluator();

    @Test
    void shouldAllowEverythingInOpenMode() {
        CommsSecurityProperties props = new CommsSecurityProperties();

        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/api/comms/calls", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/api/comms/send/sms", props));
    }

    @Test
    void shouldKeepWebhookOpenInRequiredMode() {
        CommsSecurityProperties props = new CommsSecurityProperties();
        props.setMode(CommsSecurityProperties.Mode.KEYCLOAK_REQUIRED);

        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/api/comms/webhooks/telnyx", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/api/comms/health", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/api/comms/calls/7", props));
    }

    @Test
    void shouldRequireAuthForWebhookWhenAnonymousDisabled() {
        CommsSecurityProperties props = new CommsSecurityProperties();
        props.setMode(CommsSecurityProperties.Mode.KEYCLOAK_OPTIONAL);
        props.getAnonymous().setEnabled(false);

        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/api/comms/webhooks/telnyx", props));
    }

    @Test
    void shouldKeepTechnicalEndpointsOpenButNotLookalikes() {
        CommsSecurityProperties props = new CommsSecurityProperties();
        props.setMode(CommsSecurityProperties.Mode.KEYCLOAK_REQUIRED);
        props.getAnonymous().setAllowPaths(List.of("/api/comms/webhooks/**"));

        assertEquals(SecurityModeAccessEvaluator.Decision.ALLOW, evaluator.evaluate("/health/liveness", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/swaggered/internal", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/api/comms/webhooksX", props));
        assertEquals(SecurityModeAccessEvaluator.Decision.REQUIRE_AUTH, evaluator.evaluate("/api/comms/health", props));
    }
}
