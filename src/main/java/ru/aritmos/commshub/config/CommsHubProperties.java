package ru.aritmos.commshub.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Конфигурация Comms Hub из application.yml/ENV (префикс {@code commshub}).
 * <p>
 * Бин изменяемый только ради биндинга Micronaut. Компоненты получают неизменяемые снимки
 * ({@link WebhookSettings}, {@link TelnyxSettings}, {@link PolicySettings}) в конструкторе
 * и больше не читают конфигурацию.
 */
@ConfigurationProperties("commshub")
public class CommsHubProperties {

    private Webhook webhook = new Webhook();
    private Telnyx telnyx = new Telnyx();
    private Policy policy = new Policy();
    private Storage storage = new Storage();

    public Webhook getWebhook() {
        return webhook;
    }

    public void setWebhook(Webhook webhook) {
        this.webhook = webhook == null ? new Webhook() : webhook;
    }

    public Telnyx getTelnyx() {
        return telnyx;
    }

    public void setTelnyx(Telnyx telnyx) {
        this.telnyx = telnyx == null ? new Telnyx() : telnyx;
    }

    public Policy getPolicy() {
        return policy;
    }

    public void setPolicy(Policy policy) {
        this.policy = policy == null ? new Policy() : policy;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage == null ? new Storage() : storage;
    }

    public WebhookSettings webhookSettings() {
        return new WebhookSettings(
                webhook.isRequireSignature(),
                webhook.getSignatureHeader(),
                webhook.getTimestampHeader(),
                webhook.getPublicKey(),
                webhook.getDefaultOrgId(),
                webhook.getProcessingTimeoutSec());
    }

    public TelnyxSettings telnyxSettings() {
        return new TelnyxSettings(
                telnyx.getApiKey(),
                telnyx.getFromNumber(),
                telnyx.getMessagingProfileId(),
                telnyx.getConnectionId(),
                telnyx.getBaseUrl(),
                telnyx.getHttpTimeoutMs());
    }

    public PolicySettings policySettings() {
        return new PolicySettings(policy.getTranscriptConfidenceThreshold(), policy.getAmbientNoiseBlockThreshold());
    }

    @ConfigurationProperties("webhook")
    public static class Webhook {
        private boolean requireSignature = true;
        private String signatureHeader = "telnyx-signature-ed25519";
        private String timestampHeader = "telnyx-timestamp";
        private String publicKey;
        private Long defaultOrgId;
        private int processingTimeoutSec = 10;

        public boolean isRequireSignature() {
            return requireSignature;
        }

        public void setRequireSignature(boolean requireSignature) {
            this.requireSignature = requireSignature;
        }

        public String getSignatureHeader() {
            return signatureHeader;
        }

        public void setSignatureHeader(String signatureHeader) {
            this.signatureHeader = blankTo(signatureHeader, "telnyx-signature-ed25519");
        }

        public String getTimestampHeader() {
            return timestampHeader;
        }

        public void setTimestampHeader(String timestampHeader) {
            this.timestampHeader = blankTo(timestampHeader, "telnyx-timestamp");
        }

        public String getPublicKey() {
            return publicKey;
        }

        public void setPublicKey(String publicKey) {
            this.publicKey = publicKey;
        }

        public Long getDefaultOrgId() {
            return defaultOrgId;
        }

        public void setDefaultOrgId(Long defaultOrgId) {
            this.defaultOrgId = defaultOrgId;
        }

        public int getProcessingTimeoutSec() {
            return processingTimeoutSec;
        }

        public void setProcessingTimeoutSec(int processingTimeoutSec) {
            this.processingTimeoutSec = Math.max(1, processingTimeoutSec);
        }
    }

    @ConfigurationProperties("telnyx")
    public static class Telnyx {
        private String apiKey;
        private String fromNumber;
        private String messagingProfileId;
        private String connectionId;
        private String baseUrl = "https://api.telnyx.com/v2";
        private int httpTimeoutMs = 8000;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getFromNumber() {
            return fromNumber;
        }

        public void setFromNumber(String fromNumber) {
            this.fromNumber = fromNumber;
        }

        public String getMessagingProfileId() {
            return messagingProfileId;
        }

        public void setMessagingProfileId(String messagingProfileId) {
            this.messagingProfileId = messagingProfileId;
        }

        public String getConnectionId() {
            return connectionId;
        }

        public void setConnectionId(String connectionId) {
            this.connectionId = connectionId;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = blankTo(baseUrl, "https://api.telnyx.com/v2");
        }

        public int getHttpTimeoutMs() {
            return httpTimeoutMs;
        }

        public void setHttpTimeoutMs(int httpTimeoutMs) {
            this.httpTimeoutMs = httpTimeoutMs <= 0 ? 8000 : httpTimeoutMs;
        }
    }

    @ConfigurationProperties("policy")
    public static class Policy {
        private double transcriptConfidenceThreshold = 0.75;
        private double ambientNoiseBlockThreshold = 0.7;

        public double getTranscriptConfidenceThreshold() {
            return transcriptConfidenceThreshold;
        }

        public void setTranscriptConfidenceThreshold(double transcriptConfidenceThreshold) {
            this.transcriptConfidenceThreshold = transcriptConfidenceThreshold;
        }

        public double getAmbientNoiseBlockThreshold() {
            return ambientNoiseBlockThreshold;
        }

        public void setAmbientNoiseBlockThreshold(double ambientNoiseBlockThreshold) {
            this.ambientNoiseBlockThreshold = ambientNoiseBlockThreshold;
        }
    }

    @ConfigurationProperties("storage")
    public static class Storage {
        private String baseDir = "./data/recordings";

        public String getBaseDir() {
            return baseDir;
        }

        public void setBaseDir(String baseDir) {
            this.baseDir = blankTo(baseDir, "./data/recordings");
        }
    }

    private static String blankTo(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }
}
