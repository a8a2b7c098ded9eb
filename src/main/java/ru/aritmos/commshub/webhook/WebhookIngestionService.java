package ru.aritmos.commshub.webhook;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.collab.AuditSink;
import ru.aritmos.commshub.collab.OrganizationDirectory;
import ru.aritmos.commshub.config.CommsHubProperties;
import ru.aritmos.commshub.config.WebhookSettings;
import ru.aritmos.commshub.model.CallEventDraft;
import ru.aritmos.commshub.model.CallLogPatch;
import ru.aritmos.commshub.model.SystemActor;
import ru.aritmos.commshub.store.CallAggregateRepository;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Обработка одной доставки webhook провайдера.
 * <p>
 * Порядок: подпись → разбор JSON → нормализация типа → организация и модуль → идемпотентное применение
 * к агрегату звонка (одна транзакция) → аудит.
 * <p>
 * Мягкие пропуски ({@code no_org}, {@code module_disabled}) отвечают 200: провайдер повторяет доставку
 * на любой не-2xx ответ.
 */
@Singleton
public class WebhookIngestionService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);

    public static final String STATUS_OK = "ok";
    public static final String STATUS_NO_ORG = "no_org";
    public static final String STATUS_MODULE_DISABLED = "module_disabled";

    /**
     * Итог обработки доставки.
     *
     * @param callId id агрегата звонка (null для мягкого пропуска)
     * @param accepted событие новое (false для дубликата)
     * @param created доставка создала новый агрегат
     */
    @Serdeable
    public record Outcome(String status, Long callId, Boolean accepted, Boolean created) {

        static Outcome skipped(String status) {
            return new Outcome(status, null, null, null);
        }
    }

    private final WebhookSettings settings;
    private final WebhookSignatureVerifier verifier;
    private final WebhookEventParser parser;
    private final TelnyxEventNormalizer normalizer;
    private final OrganizationDirectory organizations;
    private final CallAggregateRepository calls;
    private final AuditSink auditSink;

    @Inject
    public WebhookIngestionService(CommsHubProperties properties,
                                   WebhookSignatureVerifier verifier,
                                   WebhookEventParser parser,
                                   TelnyxEventNormalizer normalizer,
                                   OrganizationDirectory organizations,
                                   CallAggregateRepository calls,
                                   AuditSink auditSink) {
        this(properties.webhookSettings(), verifier, parser, normalizer, organizations, calls, auditSink);
    }

    public WebhookIngestionService(WebhookSettings settings,
                                   WebhookSignatureVerifier verifier,
                                   WebhookEventParser parser,
                                   TelnyxEventNormalizer normalizer,
                                   OrganizationDirectory organizations,
                                   CallAggregateRepository calls,
                                   AuditSink auditSink) {
        this.settings = settings;
        this.verifier = verifier;
        this.parser = parser;
        this.normalizer = normalizer;
        this.organizations = organizations;
        this.calls = calls;
        this.auditSink = auditSink;
    }

    /**
     * Обработать доставку.
     *
     * @param rawBody исходные байты тела
     * @param signature значение заголовка подписи
     * @param timestamp значение заголовка времени
     * @param correlationId идентификатор корреляции для логов
     * @throws ru.aritmos.commshub.core.AuthenticationException подпись не прошла проверку (ничего не записано)
     * @throws IllegalArgumentException тело не является JSON-объектом
     */
    public Outcome ingest(byte[] rawBody, String signature, String timestamp, String correlationId) {
        verifier.verifyDelivery(rawBody, signature, timestamp);

        WebhookEvent event = parser.parse(rawBody);
        TelnyxEventNormalizer.Normalized normalized = normalizer.normalize(event.rawEventType());

        Long orgId = event.orgId() != null ? event.orgId() : settings.defaultOrgId();
        if (orgId == null || !organizations.exists(orgId)) {
            log.info("[WEBHOOK] skipped status={} type={} corr={}", STATUS_NO_ORG, event.rawEventType(), correlationId);
            return Outcome.skipped(STATUS_NO_ORG);
        }
        if (!organizations.moduleEnabled(orgId, OrganizationDirectory.COMMS_MODULE)) {
            log.info("[WEBHOOK] skipped status={} org={} type={} corr={}", STATUS_MODULE_DISABLED, orgId, event.rawEventType(), correlationId);
            return Outcome.skipped(STATUS_MODULE_DISABLED);
        }

        CallLogPatch patch = new CallLogPatch(
                event.externalCallId(),
                event.direction(),
                event.caller(),
                event.recipient(),
                event.rawEventType(),
                normalized.state(),
                event.dtmfDigits(),
                event.durationSeconds(),
                event.recordingUrl(),
                event.disposition(),
                event.occurredAt(),
                event.rawJson());
        CallEventDraft draft = new CallEventDraft(
                emptyToNull(event.externalCallId()),
                normalized.type(),
                event.rawEventType(),
                event.providerEventId(),
                event.occurredAt(),
                event.rawJson());

        CallAggregateRepository.ApplyResult result =
                calls.apply(orgId, patch, draft, emptyToNull(event.recordingId()), settings.processingTimeoutSec());

        log.info("[WEBHOOK] applied org={} callId={} type={} canonical={} accepted={} created={} state={} corr={}",
                orgId, result.after().id(), event.rawEventType(), normalized.type().code(),
                result.accepted(), result.created(), result.after().callState(), correlationId);

        if (result.accepted()) {
            audit(orgId, result, event, normalized, correlationId);
        }
        return new Outcome(STATUS_OK, result.after().id(), result.accepted(), result.created());
    }

    private void audit(long orgId,
                       CallAggregateRepository.ApplyResult result,
                       WebhookEvent event,
                       TelnyxEventNormalizer.Normalized normalized,
                       String correlationId) {
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("call_id", result.after().id());
        after.put("event_type", event.rawEventType());
        after.put("call_state", result.after().callState().name());
        after.put("external_call_id", result.after().externalCallId());
        if (result.recording() != null) {
            after.put("recording_id", result.recording().id());
        }
        Map<String, Object> before = null;
        if (result.before() != null) {
            before = new LinkedHashMap<>();
            before.put("call_state", result.before().callState().name());
        }
        try {
            auditSink.record(orgId, SystemActor.TELNYX_WEBHOOK, result.created() ? "create" : "update",
                    "comms_call", String.valueOf(result.after().id()), before, after, normalized.type().code());
        } catch (RuntimeException e) {
            // событие уже зафиксировано, ответ доставки остаётся 200
            log.warn("[WEBHOOK][AUDIT] audit failed org={} callId={} corr={} err={}",
                    orgId, result.after().id(), correlationId, e.toString(), e);
        }
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
