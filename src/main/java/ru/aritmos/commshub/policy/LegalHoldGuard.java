package ru.aritmos.commshub.policy;

import jakarta.inject.Singleton;
import ru.aritmos.commshub.collab.LegalHoldDirectory;

import java.util.Optional;

/**
 * Проверка активного legal hold перед изменением или выдачей ресурса.
 */
@Singleton
public class LegalHoldGuard {

    public static final String CALL_RESOURCE = "comms_call";
    public static final String RECORDING_RESOURCE = "comms_recording";

    private final LegalHoldDirectory directory;

    public LegalHoldGuard(LegalHoldDirectory directory) {
        this.directory = directory;
    }

    public Optional<LegalHoldDirectory.Hold> activeHold(long orgId, String resourceType, long resourceId) {
        return directory.active(orgId, resourceType, String.valueOf(resourceId));
    }
}
