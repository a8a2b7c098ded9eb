package ru.aritmos.commshub.delivery;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.collab.AuditSink;
import ru.aritmos.commshub.core.ConfigurationException;
import ru.aritmos.commshub.core.OutboundSendException;
import ru.aritmos.commshub.core.SensitiveDataSanitizer;
import ru.aritmos.commshub.model.CommsEvent;
import ru.aritmos.commshub.model.DeliveryStatus;
import ru.aritmos.commshub.model.OutboundChannel;
import ru.aritmos.commshub.model.SystemActor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Исходящая отправка SMS/факса/звонка с учётом попыток.
 * <p>
 * Сначала записывается, потом сообщается: Event создаётся до вызова провайдера, исход попытки
 * фиксируется всегда, и только после этого ошибка пробрасывается вызывающему.
 */
@Singleton
public class OutboundSendService {

    private static final Logger log = LoggerFactory.getLogger(OutboundSendService.class);

    /**
     * Результат успешной отправки.
     */
    @Serdeable
    public record SendResult(long eventId, String status, String providerMessageId) {
    }

    private final OutboundSender sender;
    private final DeliveryAttemptTracker tracker;
    private final AuditSink auditSink;

    public OutboundSendService(OutboundSender sender, DeliveryAttemptTracker tracker, AuditSink auditSink) {
        this.sender = sender;
        this.tracker = tracker;
        this.auditSink = auditSink;
    }

    /**
     * Отправить сообщение.
     *
     * @throws IllegalArgumentException неверный запрос (ничего не записано)
     * @throws ConfigurationException не настроены учётные данные (Event в статусе failed)
     * @throws OutboundSendException ошибка провайдера (Event в статусе failed)
     */
    public SendResult send(long orgId, SystemActor actor, OutboundChannel channel, SendRequest request) {
        validate(channel, request);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recipient", request.recipient().trim());
        payload.put("preview", SensitiveDataSanitizer.redactDigits(request.body()));
        if (request.mediaUrl() != null && !request.mediaUrl().isBlank()) {
            payload.put("media_url", request.mediaUrl().trim());
        }
        CommsEvent event = tracker.openEvent(orgId, channel, payload);
        audit(orgId, actor, event.id(), channel, DeliveryStatus.QUEUED);

        String providerId;
        try {
            providerId = sender.send(channel, request.recipient().trim(), request.body(), request.mediaUrl());
        } catch (ConfigurationException | OutboundSendException | IllegalArgumentException e) {
            tracker.recordAttempt(orgId, event.id(), sender.providerName(), DeliveryStatus.FAILED, null, e.getMessage());
            audit(orgId, actor, event.id(), channel, DeliveryStatus.FAILED);
            log.warn("[DELIVERY] send failed org={} eventId={} channel={} err={}",
                    orgId, event.id(), channel.code(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            throw e;
        }

        tracker.recordAttempt(orgId, event.id(), sender.providerName(), DeliveryStatus.SENT,
                Map.of("provider_message_id", providerId), null);
        audit(orgId, actor, event.id(), channel, DeliveryStatus.SENT);
        return new SendResult(event.id(), DeliveryStatus.SENT.code(), providerId);
    }

    /**
     * Поставить Event на повтор. Провайдер не вызывается.
     */
    public CommsEvent retry(long orgId, SystemActor actor, long eventId) {
        CommsEvent event = tracker.markRetryQueued(orgId, eventId);
        auditSink.record(orgId, actor, "update", "comms_event", String.valueOf(eventId),
                null, Map.of("event_id", eventId, "status", event.status()), "comms.event.retry");
        return event;
    }

    public boolean providerConfigured() {
        return sender.configured();
    }

    private static void validate(OutboundChannel channel, SendRequest request) {
        if (request == null || request.recipient() == null || request.recipient().isBlank()) {
            throw new IllegalArgumentException("Не указан получатель");
        }
        if (channel == OutboundChannel.FAX && (request.mediaUrl() == null || request.mediaUrl().isBlank())) {
            throw new IllegalArgumentException("Для факса обязателен media_url");
        }
        if (channel == OutboundChannel.SMS && (request.body() == null || request.body().isBlank())) {
            throw new IllegalArgumentException("Не указан текст SMS");
        }
    }

    private void audit(long orgId, SystemActor actor, long eventId, OutboundChannel channel, DeliveryStatus status) {
        auditSink.record(orgId, actor, status == DeliveryStatus.QUEUED ? "create" : "update", "comms_event",
                String.valueOf(eventId), null, Map.of("event_id", eventId, "status", status.code()),
                "comms." + channel.code() + ".send");
    }
}
