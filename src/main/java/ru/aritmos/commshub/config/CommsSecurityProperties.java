package ru.aritmos.commshub.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.util.List;

/**
 * Typed-конфигурация security-контура Comms Hub.
 * <p>
 * Webhook провайдера по умолчанию входит в anonymous allow-paths: его аутентификацией служит подпись Ed25519.
 */
@ConfigurationProperties("commshub.security")
public class CommsSecurityProperties {

    public enum Mode {
        OPEN,
        KEYCLOAK_OPTIONAL,
        KEYCLOAK_REQUIRED
    }

    private Mode mode = Mode.OPEN;

    private Anonymous anonymous = new Anonymous();

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode == null ? Mode.OPEN : mode;
    }

    public Anonymous getAnonymous() {
        return anonymous;
    }

    public void setAnonymous(Anonymous anonymous) {
        this.anonymous = anonymous == null ? new Anonymous() : anonymous;
    }

    @ConfigurationProperties("anonymous")
    public static class Anonymous {
        private boolean enabled = true;
        private List<String> allowPaths = List.of("/api/comms/webhooks/**", "/api/comms/health");

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getAllowPaths() {
            return allowPaths;
        }

        public void setAllowPaths(List<String> allowPaths) {
            this.allowPaths = (allowPaths == null || allowPaths.isEmpty()) ? List.of() : List.copyOf(allowPaths);
        }
    }
}
