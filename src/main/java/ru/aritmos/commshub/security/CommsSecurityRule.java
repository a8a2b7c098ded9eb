package ru.aritmos.commshub.security;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.rules.SecuredAnnotationRule;
import io.micronaut.security.rules.SecurityRule;
import io.micronaut.security.rules.SecurityRuleResult;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.config.CommsSecurityProperties;

/**
 * Глобальное правило доступа Comms Hub.
 *
 * <p>Срабатывает раньше аннотационных правил @Secured: открытые пути (webhook, health) пропускаются сразу,
 * анонимный запрос к закрытому пути отклоняется, аутентифицированный передаётся дальше по цепочке.
 */
@Singleton
public class CommsSecurityRule implements SecurityRule<HttpRequest<?>> {

    private static final Logger log = LoggerFactory.getLogger(CommsSecurityRule.class);

    private final CommsSecurityProperties securityProperties;
    private final SecurityModeAccessEvaluator evaluator;

    public CommsSecurityRule(CommsSecurityProperties securityProperties,
                             SecurityModeAccessEvaluator evaluator) {
        this.securityProperties = securityProperties;
        this.evaluator = evaluator;
    }

    @Override
    public Publisher<SecurityRuleResult> check(HttpRequest<?> request, Authentication authentication) {
        return Publishers.just(resolve(request == null ? null : request.getPath(), authentication != null));
    }

    SecurityRuleResult resolve(String path, boolean authenticated) {
        if (evaluator.evaluate(path, securityProperties) == SecurityModeAccessEvaluator.Decision.ALLOW) {
            return SecurityRuleResult.ALLOWED;
        }
        if (!authenticated) {
            log.debug("[SECURITY] anonymous request rejected path={} mode={}", path, securityProperties.getMode());
            return SecurityRuleResult.REJECTED;
        }
        return SecurityRuleResult.UNKNOWN;
    }

    @Override
    public int getOrder() {
        return SecuredAnnotationRule.ORDER - 10;
    }
}
