package ru.aritmos.commshub;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа Comms Hub.
 * <p>
 * Сервис принимает webhook-события телеком-провайдера (звонки, SMS, факс), проверяет их подлинность,
 * нормализует в канонический набор событий и восстанавливает состояние звонка с таймлайном.
 * <p>
 * Важно: повторные и переупорядоченные доставки являются штатной ситуацией. Корректность обеспечивается
 * уникальным ключом идемпотентности в БД, а не порядком прихода запросов.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}
