package ru.aritmos.commshub.policy;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.commshub.config.CommsHubProperties;
import ru.aritmos.commshub.config.PolicySettings;
import ru.aritmos.commshub.core.PayloadHasher;
import ru.aritmos.commshub.model.TranscriptRequest;
import ru.aritmos.commshub.model.VoicePlanRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Правила решений для чувствительных операций модуля связи.
 * <p>
 * Все методы чистые: результат проверки legal hold передаётся на вход, хранилища не читаются.
 */
@Singleton
public class CommsPolicyRules {

    public static final String LEGAL_HOLD_TRANSCRIPT = "COMMS.LEGAL_HOLD.BLOCK_TRANSCRIPT.v1";
    public static final String LEGAL_HOLD_RECORDING = "COMMS.LEGAL_HOLD.BLOCK_RECORDING.v1";
    public static final String TRANSCRIPT_LOW_CONFIDENCE = "COMMS.TRANSCRIPT.CONFIDENCE.WARN.v1";
    public static final String TRANSCRIPT_ALLOW = "COMMS.TRANSCRIPT.ALLOW.v1";
    public static final String RECORDING_ALLOW = "COMMS.RECORDING.ALLOW.v1";
    public static final String VOICE_SPEAKER_DISABLED = "VOICE.SPEAKER.DISABLED.v1";
    public static final String VOICE_NOISE_BLOCK = "VOICE.NOISE.BLOCK.v1";
    public static final String VOICE_ALLOW = "VOICE.PLAN.ALLOW.v1";

    private final PolicySettings settings;

    @Inject
    public CommsPolicyRules(CommsHubProperties properties) {
        this(properties.policySettings());
    }

    public CommsPolicyRules(PolicySettings settings) {
        this.settings = settings == null ? PolicySettings.defaults() : settings;
    }

    /**
     * Хэш содержимого стенограммы (текст, сегменты, уверенность).
     */
    public static String transcriptHash(TranscriptRequest request) {
        return PayloadHasher.hash(transcriptContent(request));
    }

    private static Map<String, Object> transcriptContent(TranscriptRequest request) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("transcript_text", request.text());
        content.put("segments", request.segments());
        content.put("confidence", request.confidence());
        return content;
    }

    /**
     * Решение по созданию стенограммы.
     *
     * @param callId id звонка
     * @param underHold на звонке активен legal hold
     */
    public DecisionPacket transcript(long callId, boolean underHold, TranscriptRequest request) {
        DecisionReasoner reasoner = new DecisionReasoner("comms_transcript", "v1");
        if (underHold) {
            reasoner.addReason(LEGAL_HOLD_TRANSCRIPT, "Legal hold запрещает изменение стенограммы",
                    Severity.HIGH, Decision.BLOCK, List.of());
            return reasoner.evaluate(Map.of("call_id", callId));
        }

        String ref = reasoner.addEvidence(Evidence.ofContent("transcript", "call:" + callId, transcriptContent(request)));
        if (request.confidence() < settings.transcriptConfidenceThreshold()) {
            reasoner.addReason(TRANSCRIPT_LOW_CONFIDENCE, "Уверенность распознавания ниже порога",
                    Severity.MEDIUM, Decision.REQUIRE_CONFIRMATION, List.of(ref));
        } else {
            reasoner.addReason(TRANSCRIPT_ALLOW, "Стенограмма принята", Severity.LOW, Decision.ALLOW, List.of(ref));
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("call_id", callId);
        input.put("evidence_hash", transcriptHash(request));
        return reasoner.evaluate(input);
    }

    /**
     * Решение по выдаче записи разговора.
     */
    public DecisionPacket recordingDownload(long recordingId, boolean underHold) {
        DecisionReasoner reasoner = new DecisionReasoner("comms_recording", "v1");
        if (underHold) {
            reasoner.addReason(LEGAL_HOLD_RECORDING, "Legal hold запрещает доступ к записи",
                    Severity.HIGH, Decision.BLOCK, List.of());
        } else {
            reasoner.addReason(RECORDING_ALLOW, "Доступ к записи разрешён", Severity.LOW, Decision.ALLOW, List.of());
        }
        return reasoner.evaluate(Map.of("recording_id", recordingId));
    }

    /**
     * Решение по голосовому выводу.
     */
    public DecisionPacket voicePlan(VoicePlanRequest request) {
        DecisionReasoner reasoner = new DecisionReasoner("comms_voice_plan", "v1");
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("urgency", request.urgency());
        meta.put("ambient_noise", request.ambientNoise());
        meta.put("allow_speaker", request.allowSpeaker());
        String ref = reasoner.addEvidence(Evidence.of("voice_request", "comms_voice", meta));

        boolean restricted = false;
        if (!Boolean.TRUE.equals(request.allowSpeaker())) {
            reasoner.addReason(VOICE_SPEAKER_DISABLED, "Вывод на динамик устройства отключён",
                    Severity.MEDIUM, Decision.REQUIRE_CONFIRMATION, List.of(ref));
            restricted = true;
        }
        if (request.ambientNoise() >= settings.ambientNoiseBlockThreshold()) {
            reasoner.addReason(VOICE_NOISE_BLOCK, "Слишком высокий уровень шума для голосового вывода",
                    Severity.HIGH, Decision.BLOCK, List.of(ref));
            restricted = true;
        }
        if (!restricted) {
            reasoner.addReason(VOICE_ALLOW, "Голосовой вывод разрешён", Severity.LOW, Decision.ALLOW, List.of(ref));
        }

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("message_hash", PayloadHasher.sha256Hex(request.message() == null ? "" : request.message()));
        input.put("urgency", request.urgency());
        input.put("ambient_noise", request.ambientNoise());
        input.put("allow_speaker", request.allowSpeaker());
        return reasoner.evaluate(input);
    }
}
