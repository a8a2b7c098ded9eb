package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

import java.time.Instant;
import java.util.List;

/**
 * Логическая единица исходящей работы (например, «отправить это SMS»).
 * <p>
 * Текущий статус определяется последней попыткой; {@code retry_queued} выставляет оператор.
 *
 * @param payloadJson получатель и обезличенное превью тела (сырой текст не хранится)
 * @param attempts история попыток (заполняется только в детальном просмотре)
 */
@Serdeable
public record CommsEvent(long id,
                         long orgId,
                         String channel,
                         String status,
                         String payloadJson,
                         Instant createdAt,
                         Instant updatedAt,
                         List<DeliveryAttempt> attempts) {

    public CommsEvent withAttempts(List<DeliveryAttempt> list) {
        return new CommsEvent(id, orgId, channel, status, payloadJson, createdAt, updatedAt, list == null ? List.of() : list);
    }
}
