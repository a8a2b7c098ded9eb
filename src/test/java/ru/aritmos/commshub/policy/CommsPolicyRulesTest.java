package ru.aritmos.commshub.policy;

import org.junit.jupiter.api.Test;
import ru.aritmos.commshub.config.PolicySettings;
import ru.aritmos.commshub.model.TranscriptRequest;
import ru.aritmos.commshub.model.TranscriptSegment;
import ru.aritmos.commshub.model.VoicePlanRequest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommsPolicyRulesTest {

    private final CommsPolicyRules rules = new CommsPolicyRules(PolicySettings.defaults());

    private static TranscriptRequest transcript(double confidence) {
        return new TranscriptRequest("Добрый день, чем помочь?",
                List.of(new TranscriptSegment(0.0, 2.5, "agent", "Добрый день, чем помочь?", confidence)),
                confidence, null);
    }

    @Test
    void transcript_shouldBlockUnderLegalHold() {
        DecisionPacket packet = rules.transcript(7L, true, transcript(0.99));

        assertEquals(Decision.BLOCK, packet.decision());
        assertEquals(List.of(CommsPolicyRules.LEGAL_HOLD_TRANSCRIPT), packet.ruleIds());
        assertEquals(Severity.HIGH, packet.reasons().get(0).severity());
        assertEquals(0.55, packet.confidence(), 1e-9);
    }

    @Test
    void transcript_shouldRequireConfirmationBelowThreshold() {
        DecisionPacket packet = rules.transcript(7L, false, transcript(0.5));

        assertEquals(Decision.REQUIRE_CONFIRMATION, packet.decision());
        assertEquals(List.of(CommsPolicyRules.TRANSCRIPT_LOW_CONFIDENCE), packet.ruleIds());
        assertEquals(1, packet.evidence().size());
        assertEquals(CommsPolicyRules.transcriptHash(transcript(0.5)), packet.evidence().get(0).metadata().get("content_hash"));
        assertEquals(List.of(packet.evidence().get(0).hash()), packet.reasons().get(0).evidenceRefs());
    }

    @Test
    void transcript_shouldAllowConfidentTranscript() {
        DecisionPacket packet = rules.transcript(7L, false, transcript(0.9));

        assertEquals(Decision.ALLOW, packet.decision());
        assertEquals(List.of(CommsPolicyRules.TRANSCRIPT_ALLOW), packet.ruleIds());
    }

    @Test
    void recordingDownload_shouldBlockOnlyUnderHold() {
        assertTrue(rules.recordingDownload(3L, true).blocked());
        assertEquals(List.of(CommsPolicyRules.LEGAL_HOLD_RECORDING), rules.recordingDownload(3L, true).ruleIds());
        assertEquals(Decision.ALLOW, rules.recordingDownload(3L, false).decision());
    }

    @Test
    void voicePlan_shouldCombineNoiseAndSpeakerRules() {
        DecisionPacket both = rules.voicePlan(new VoicePlanRequest("Пожарная тревога", "urgent", 0.9, false));
        DecisionPacket speakerOnly = rules.voicePlan(new VoicePlanRequest("Напоминание", null, 0.1, false));
        DecisionPacket clear = rules.voicePlan(new VoicePlanRequest("Напоминание", null, 0.1, null));

        assertEquals(Decision.BLOCK, both.decision());
        assertEquals(List.of(CommsPolicyRules.VOICE_SPEAKER_DISABLED, CommsPolicyRules.VOICE_NOISE_BLOCK), both.ruleIds());
        assertEquals(0.4, both.confidence(), 1e-9);
        assertEquals(Decision.REQUIRE_CONFIRMATION, speakerOnly.decision());
        assertEquals(Decision.ALLOW, clear.decision());
        assertEquals(List.of(CommsPolicyRules.VOICE_ALLOW), clear.ruleIds());
    }

    @Test
    void voicePlan_shouldHonourConfiguredNoiseThreshold() {
        CommsPolicyRules strict = new CommsPolicyRules(new PolicySettings(0.75, 0.3));

        assertEquals(Decision.BLOCK, strict.voicePlan(new VoicePlanRequest("x", null, 0.35, true)).decision());
        assertEquals(Decision.ALLOW, rules.voicePlan(new VoicePlanRequest("x", null, 0.35, true)).decision());
    }
}
