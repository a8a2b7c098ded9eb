package ru.aritmos.commshub.collab;

/**
 * Справочник организаций и включённых модулей (внешний коллаборатор).
 */
public interface OrganizationDirectory {

    String COMMS_MODULE = "COMMS";

    boolean exists(long orgId);

    /**
     * @return true, если модуль включён и для него не взведён kill switch; модуль без записи в реестре считается выключенным
     */
    boolean moduleEnabled(long orgId, String moduleKey);
}
