package ru.aritmos.commshub.security;

/**
 * Роли API Comms Hub (проверяются аннотациями {@code @Secured} в режимах KEYCLOAK_*).
 */
public final class CommsRoles {

    public static final String ADMIN = "COMMS_ADMIN";
    public static final String OPERATOR = "COMMS_OPERATOR";
    public static final String READONLY = "COMMS_READONLY";

    private CommsRoles() {
    }
}
