package ru.aritmos.commshub.collab;

import java.util.Optional;

/**
 * Поиск политики хранения по ключу классификации ({@code comms_billing}, {@code comms_ops}).
 */
public interface RetentionPolicyDirectory {

    Optional<Policy> lookup(long orgId, String classificationKey);

    record Policy(long id, long orgId, String appliesTo, Integer retentionDays) {
    }
}
