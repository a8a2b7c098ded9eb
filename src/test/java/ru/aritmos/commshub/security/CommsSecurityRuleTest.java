package ru.aritmos.commshub.security;

import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.rules.SecurityRuleResult;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import ru.aritmos.commshub.config.CommsSecurityProperties;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CommsSecurityRuleTest {

    private static CommsSecurityRule rule(CommsSecurityProperties.Mode mode) {
        CommsSecurityProperties props = new CommsSecurityProperties();
        props.setMode(mode);
        return new CommsSecurityRule(props, new SecurityModeAccessEvaluator());
    }

    @Test
    void shouldAllowSignedWebhookWithoutToken() {
        SecurityRuleResult result = single(rule(CommsSecurityProperties.Mode.KEYCLOAK_REQUIRED)
                .check(HttpRequest.POST("/api/comms/webhooks/telnyx", "{}"), null));
        assertEquals(SecurityRuleResult.ALLOWED, result);
    }

    @Test
    void shouldRejectAnonymousOperatorEndpoint() {
        SecurityRuleResult result = single(rule(CommsSecurityProperties.Mode.KEYCLOAK_REQUIRED)
                .check(HttpRequest.POST("/api/comms/send/sms", "{}"), null));
        assertEquals(SecurityRuleResult.REJECTED, result);
    }

    @Test
    void shouldDelegateToSecuredAnnotationsWhenAuthenticated() {
        SecurityRuleResult result = single(rule(CommsSecurityProperties.Mode.KEYCLOAK_OPTIONAL)
                .check(HttpRequest.GET("/api/comms/calls"), Authentication.build("operator", List.of(CommsRoles.OPERATOR))));
        assertEquals(SecurityRuleResult.UNKNOWN, result);
    }

    @Test
    void resolve_shouldAllowAllInOpenMode() {
        assertEquals(SecurityRuleResult.ALLOWED, rule(CommsSecurityProperties.Mode.OPEN).resolve("/api/comms/queue", false));
    }

    private SecurityRuleResult single(Publisher<SecurityRuleResult> publisher) {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<SecurityRuleResult> ref = new AtomicReference<>();

        publisher.subscribe(new Subscriber<>() {
            @Override
            public void onSubscribe(Subscription s) {
                s.request(1);
            }

            @Override
            public void onNext(SecurityRuleResult securityRuleResult) {
                ref.set(securityRuleResult);
            }

            @Override
            public void onError(Throwable t) {
                latch.countDown();
            }

            @Override
            public void onComplete() {
                latch.countDown();
            }
        });

        try {
            latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            throw new IllegalStateException("Прервано ожидание результата SecurityRule", e);
        }
        return ref.get();
    }
}
