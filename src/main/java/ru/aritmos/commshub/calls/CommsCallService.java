package ru.aritmos.commshub.calls;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.serde.annotation.Serdeable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.collab.AuditSink;
import ru.aritmos.commshub.collab.RetentionPolicyDirectory;
import ru.aritmos.commshub.collab.StorageBackend;
import ru.aritmos.commshub.config.CommsHubProperties;
import ru.aritmos.commshub.core.NotFoundException;
import ru.aritmos.commshub.core.PayloadHasher;
import ru.aritmos.commshub.model.CallCreateRequest;
import ru.aritmos.commshub.model.CallEvent;
import ru.aritmos.commshub.model.CallLog;
import ru.aritmos.commshub.model.CallState;
import ru.aritmos.commshub.model.Recording;
import ru.aritmos.commshub.model.SystemActor;
import ru.aritmos.commshub.model.Transcript;
import ru.aritmos.commshub.model.TranscriptRequest;
import ru.aritmos.commshub.model.VoicePlanRequest;
import ru.aritmos.commshub.policy.CommsPolicyRules;
import ru.aritmos.commshub.policy.DecisionPacket;
import ru.aritmos.commshub.policy.LegalHoldGuard;
import ru.aritmos.commshub.policy.PolicyBlockedException;
import ru.aritmos.commshub.store.CallAggregateRepository;
import ru.aritmos.commshub.store.CallEventStore;
import ru.aritmos.commshub.store.RecordingRepository;
import ru.aritmos.commshub.store.TranscriptRepository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Операции API над звонками: регистрация, чтение, привязка, стенограмма, выдача записи, план голосового вывода.
 * <p>
 * Все выборки ограничены организацией вызывающего. Изменяющие операции сначала проверяют legal hold
 * и строят decision packet; при BLOCK запись не выполняется, а пакет уходит клиенту в
 * {@link PolicyBlockedException}.
 */
@Singleton
public class CommsCallService {

    private static final Logger log = LoggerFactory.getLogger(CommsCallService.class);

    public static final String AUDIO_MPEG = "audio/mpeg";

    @Serdeable
    public record TranscriptResult(Transcript transcript, DecisionPacket decision) {
    }

    @Serdeable
    public record SpeechPlan(String engine, String urgency, String message) {
    }

    @Serdeable
    public record VoicePlanResult(DecisionPacket decision, SpeechPlan speechPlan) {
    }

    /**
     * Содержимое записи: либо байты из хранилища, либо ссылка провайдера.
     */
    public record RecordingContent(byte[] bytes, String contentType, String recordingUrl) {

        public boolean hasBytes() {
            return bytes != null;
        }
    }

    private final CallAggregateRepository calls;
    private final CallEventStore events;
    private final RecordingRepository recordings;
    private final TranscriptRepository transcripts;
    private final RetentionPolicyDirectory retentionPolicies;
    private final StorageBackend storage;
    private final LegalHoldGuard legalHoldGuard;
    private final CommsPolicyRules rules;
    private final AuditSink auditSink;
    private final ObjectMapper objectMapper;
    private final int timeoutSec;

    @Inject
    public CommsCallService(CallAggregateRepository calls,
                            CallEventStore events,
                            RecordingRepository recordings,
                            TranscriptRepository transcripts,
                            RetentionPolicyDirectory retentionPolicies,
                            StorageBackend storage,
                            LegalHoldGuard legalHoldGuard,
                            CommsPolicyRules rules,
                            AuditSink auditSink,
                            ObjectMapper objectMapper,
                            CommsHubProperties properties) {
        this.calls = calls;
        this.events = events;
        this.recordings = recordings;
        this.transcripts = transcripts;
        this.retentionPolicies = retentionPolicies;
        this.storage = storage;
        this.legalHoldGuard = legalHoldGuard;
        this.rules = rules;
        this.auditSink = auditSink;
        this.objectMapper = objectMapper;
        this.timeoutSec = properties.webhookSettings().processingTimeoutSec();
    }

    /**
     * Зарегистрировать звонок вручную.
     */
    public CallLog createCall(long orgId, SystemActor actor, CallCreateRequest request) {
        return register(orgId, actor, request, CallState.UNKNOWN, "comms.call.created");
    }

    /**
     * Зарегистрировать исходящий звонок, начатый оператором: агрегат создаётся в состоянии INITIATED.
     */
    public CallLog initiateOutbound(long orgId, SystemActor actor, CallCreateRequest request) {
        return register(orgId, actor, request, CallState.INITIATED, "comms.call.initiated");
    }

    private CallLog register(long orgId, SystemActor actor, CallCreateRequest request, CallState state, String eventType) {
        if (request == null || isBlank(request.caller()) || isBlank(request.recipient())) {
            throw new IllegalArgumentException("Не указаны caller и recipient");
        }
        if (request.durationSeconds() < 0) {
            throw new IllegalArgumentException("Длительность звонка не может быть отрицательной");
        }
        requireMaxLength("caller", request.caller(), 128);
        requireMaxLength("recipient", request.recipient(), 128);
        requireMaxLength("direction", request.direction(), 32);
        requireMaxLength("disposition", request.disposition(), 128);
        requireMaxLength("external_call_id", request.externalCallId(), 256);
        requireMaxLength("recording_url", request.recordingUrl(), 2048);
        CallLog created = calls.create(CallLog.registered(orgId, request, state, Instant.now()), timeoutSec);
        auditSink.record(orgId, actor, "create", "comms_call", String.valueOf(created.id()), null,
                callSnapshot(created), eventType);
        log.info("[API] call registered org={} callId={} state={} ext={}", orgId, created.id(), state, created.externalCallId());
        return created;
    }

    public List<CallLog> list(long orgId, int limit) {
        return calls.list(orgId, limit);
    }

    public CallLog get(long orgId, long callId) {
        return calls.find(orgId, callId).orElseThrow(() -> new NotFoundException("comms_call", "Звонок не найден"));
    }

    public List<CallEvent> timeline(long orgId, String externalCallId) {
        if (externalCallId == null || externalCallId.isBlank()) {
            throw new IllegalArgumentException("Не указан внешний id звонка");
        }
        return events.timeline(orgId, externalCallId.trim());
    }

    public List<Recording> recordings(long orgId, long callId) {
        get(orgId, callId);
        return recordings.listByCall(orgId, callId);
    }

    /**
     * Привязать звонок к объекту и задать классификацию.
     */
    public CallLog link(long orgId, SystemActor actor, long callId, String objectType, String objectId, String classification) {
        CallAggregateRepository.Change change = calls.link(orgId, callId, objectType, objectId, classification, timeoutSec);
        auditSink.record(orgId, actor, "update", "comms_call", String.valueOf(callId),
                linkSnapshot(change.before()), linkSnapshot(change.after()), "comms.call.linked");
        return change.after();
    }

    /**
     * Создать стенограмму.
     *
     * @throws PolicyBlockedException на звонке активен legal hold (ничего не записано)
     */
    public TranscriptResult createTranscript(long orgId, SystemActor actor, long callId, TranscriptRequest request) {
        if (request == null || request.text() == null || request.text().isBlank()) {
            throw new IllegalArgumentException("Не указан текст стенограммы");
        }
        CallLog call = get(orgId, callId);
        boolean underHold = legalHoldGuard.activeHold(orgId, LegalHoldGuard.CALL_RESOURCE, callId).isPresent();

        DecisionPacket packet = finalizeDecision(orgId, actor, rules.transcript(callId, underHold, request),
                "comms_transcript", "comms_call", String.valueOf(callId));
        if (packet.blocked()) {
            log.info("[POLICY] transcript blocked org={} callId={} rules={}", orgId, callId, packet.ruleIds());
            throw new PolicyBlockedException("Legal hold запрещает изменение стенограммы", packet);
        }

        Long policyId = retentionPolicies.lookup(orgId, call.retentionKey())
                .map(RetentionPolicyDirectory.Policy::id)
                .orElse(null);
        Transcript transcript = transcripts.insert(
                orgId,
                callId,
                request.text(),
                toJson(request.segments()),
                (int) Math.round(Math.max(0.0, Math.min(1.0, request.confidence())) * 100),
                request.method(),
                CommsPolicyRules.transcriptHash(request),
                policyId);

        Map<String, Object> after = new LinkedHashMap<>();
        after.put("transcript_id", transcript.id());
        after.put("call_id", callId);
        after.put("evidence_hash", transcript.evidenceHash());
        after.put("decision", packet.decision().name());
        auditSink.record(orgId, actor, "create", "comms_transcript", String.valueOf(transcript.id()), null, after,
                "comms.transcript.created");
        return new TranscriptResult(transcript, packet);
    }

    /**
     * Выдать запись разговора.
     *
     * @throws PolicyBlockedException на записи активен legal hold (хранилище не читается)
     * @throws NotFoundException записи нет либо у неё нет ни ключа хранилища, ни ссылки
     */
    public RecordingContent download(long orgId, SystemActor actor, long recordingId) {
        Recording recording = recordings.find(orgId, recordingId)
                .orElseThrow(() -> new NotFoundException("comms_recording", "Запись не найдена"));
        boolean underHold = legalHoldGuard.activeHold(orgId, LegalHoldGuard.RECORDING_RESOURCE, recordingId).isPresent();
        DecisionPacket packet = rules.recordingDownload(recordingId, underHold);

        if (packet.blocked()) {
            DecisionPacket stamped = finalizeDecision(orgId, actor, packet, "comms_recording_download",
                    "comms_recording", String.valueOf(recordingId));
            auditSink.record(orgId, actor, "blocked", "comms_recording", String.valueOf(recordingId), null,
                    Map.of("recording_id", recordingId, "reason", "LEGAL_HOLD_ACTIVE"), "comms.recording.blocked");
            log.info("[POLICY] recording download blocked org={} recordingId={}", orgId, recordingId);
            throw new PolicyBlockedException("Legal hold запрещает доступ к записи", stamped);
        }

        RecordingContent content;
        if (recording.storageKey() != null && !recording.storageKey().isBlank()) {
            content = new RecordingContent(storage.readBytes(recording.storageKey()), AUDIO_MPEG, null);
        } else if (recording.recordingUrl() != null && !recording.recordingUrl().isBlank()) {
            content = new RecordingContent(null, null, recording.recordingUrl());
        } else {
            throw new NotFoundException("comms_recording", "Содержимое записи недоступно");
        }
        auditSink.record(orgId, actor, "download", "comms_recording", String.valueOf(recordingId), null,
                Map.of("recording_id", recordingId), "comms.recording.downloaded");
        return content;
    }

    /**
     * Построить план голосового вывода. Решение BLOCK возвращается клиенту как есть, без исключения.
     */
    public VoicePlanResult voicePlan(long orgId, SystemActor actor, VoicePlanRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            throw new IllegalArgumentException("Не указан текст для голосового вывода");
        }
        DecisionPacket packet = finalizeDecision(orgId, actor, rules.voicePlan(request), "voice_plan", "comms_voice", null);
        return new VoicePlanResult(packet, new SpeechPlan("local", request.urgency(), request.message()));
    }

    /**
     * Присвоить пакету id и время, зафиксировать хэш пакета в аудите.
     */
    private DecisionPacket finalizeDecision(long orgId, SystemActor actor, DecisionPacket packet,
                                            String action, String resource, String resourceId) {
        DecisionPacket stamped = packet.stamped("dec_" + UUID.randomUUID().toString().replace("-", ""), Instant.now());
        Map<String, Object> after = new LinkedHashMap<>();
        after.put("decision_id", stamped.decisionId());
        after.put("decision", stamped.decision().name());
        after.put("rule_ids", stamped.ruleIds());
        after.put("input_hash", stamped.inputHash());
        after.put("output_hash", PayloadHasher.hash(stamped));
        auditSink.record(orgId, actor, action, resource, resourceId, null, after, "comms.decision." + stamped.decision().name().toLowerCase());
        return stamped;
    }

    private static Map<String, Object> callSnapshot(CallLog log) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("call_id", log.id());
        m.put("external_call_id", log.externalCallId());
        m.put("direction", log.direction());
        m.put("call_state", log.callState().name());
        m.put("disposition", log.disposition());
        return m;
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new IllegalArgumentException("Поле " + field + " длиннее " + max + " символов");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static Map<String, Object> linkSnapshot(CallLog log) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("call_id", log.id());
        m.put("classification", log.classification());
        m.put("linked_object_type", log.linkedObjectType());
        m.put("linked_object_id", log.linkedObjectId());
        return m;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Сегменты стенограммы не сериализуются в JSON", e);
        }
    }
}
