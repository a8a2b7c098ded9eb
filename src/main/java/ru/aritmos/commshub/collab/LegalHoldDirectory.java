package ru.aritmos.commshub.collab;

import java.util.Optional;

/**
 * Источник legal hold (внешний коллаборатор).
 */
public interface LegalHoldDirectory {

    Optional<Hold> active(long orgId, String resourceType, String resourceId);

    /**
     * Активное удержание ресурса.
     *
     * @param reason основание (номер дела и т.п.), не должно содержать персональных данных
     */
    record Hold(long id, long orgId, String resourceType, String resourceId, String reason) {
    }
}
