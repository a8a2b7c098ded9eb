package ru.aritmos.commshub.security;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.security.authentication.Authentication;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.config.CommsSecurityProperties;
import ru.aritmos.commshub.core.AccessDeniedException;
import ru.aritmos.commshub.core.AuthenticationException;
import ru.aritmos.commshub.model.SystemActor;

/**
 * Определяет организацию и пользователя API-запроса.
 * <p>
 * В режиме {@code OPEN} доверяем заголовкам {@code X-Org-Id} и {@code X-User-Id}: это режим локальной
 * разработки без Keycloak. В режимах Keycloak организация берётся из атрибута {@value #ORG_ATTRIBUTE}
 * аутентификации, а пользователь из её имени. Заголовок {@code X-Org-Id} там необязателен и, если передан,
 * должен совпадать с организацией из токена.
 */
@Singleton
public class TenantResolver {

    public static final String ORG_HEADER = "X-Org-Id";
    public static final String USER_HEADER = "X-User-Id";
    public static final String ORG_ATTRIBUTE = "org_id";

    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    private final CommsSecurityProperties properties;

    @Inject
    public TenantResolver(CommsSecurityProperties properties) {
        this.properties = properties;
    }

    /** Организация и пользователь, от имени которых выполняется запрос. */
    public record Tenant(long orgId, SystemActor actor) {
    }

    public Tenant resolve(HttpRequest<?> request) {
        return resolve(request.getHeaders().get(ORG_HEADER), request.getHeaders().get(USER_HEADER),
                request.getUserPrincipal(Authentication.class).orElse(null));
    }

    /**
     * @throws IllegalArgumentException заголовок организации отсутствует (режим OPEN) или не число
     * @throws AuthenticationException  режим Keycloak, а пользователь не аутентифицирован
     * @throws AccessDeniedException    в токене нет организации или заголовок указывает на чужую
     */
    public Tenant resolve(@Nullable String orgHeader, @Nullable String userHeader, @Nullable Authentication authentication) {
        Long headerOrg = parseOrg(orgHeader);
        if (properties.getMode() == CommsSecurityProperties.Mode.OPEN) {
            if (headerOrg == null) {
                throw new IllegalArgumentException("Не указан заголовок " + ORG_HEADER);
            }
            return new Tenant(headerOrg, SystemActor.user(userHeader));
        }
        if (authentication == null) {
            throw new AuthenticationException("Требуется аутентификация");
        }
        Long tokenOrg = tokenOrg(authentication);
        if (tokenOrg == null) {
            log.warn("[SECURITY] no {} attribute user={}", ORG_ATTRIBUTE, authentication.getName());
            throw new AccessDeniedException("Пользователь не привязан к организации");
        }
        if (headerOrg != null && !headerOrg.equals(tokenOrg)) {
            log.warn("[SECURITY] org header mismatch user={} tokenOrg={} headerOrg={}",
                    authentication.getName(), tokenOrg, headerOrg);
            throw new AccessDeniedException("Нет доступа к организации " + headerOrg);
        }
        return new Tenant(tokenOrg, SystemActor.user(authentication.getName()));
    }

    private static Long parseOrg(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Заголовок " + ORG_HEADER + " должен быть числом");
        }
    }

    private static Long tokenOrg(Authentication authentication) {
        Object value = authentication.getAttributes().get(ORG_ATTRIBUTE);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof CharSequence text && !text.toString().isBlank()) {
            try {
                return Long.parseLong(text.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("[SECURITY] malformed {} attribute user={}", ORG_ATTRIBUTE, authentication.getName());
                return null;
            }
        }
        return null;
    }
}
