package ru.aritmos.commshub.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import ru.aritmos.commshub.config.CommsHubProperties;
import ru.aritmos.commshub.config.TelnyxSettings;
import ru.aritmos.commshub.core.ConfigurationException;
import ru.aritmos.commshub.core.OutboundSendException;
import ru.aritmos.commshub.model.OutboundChannel;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Отправка SMS/факса/звонка через REST API Telnyx v2 на базе JDK {@link HttpClient}.
 * <p>
 * Эндпоинты: {@code POST /messages} для SMS, {@code POST /faxes} для факса, {@code POST /calls} для звонка.
 * Id сообщения берётся из {@code data.id} ответа.
 */
@Singleton
public class TelnyxOutboundSender implements OutboundSender {

    public static final String PROVIDER = "telnyx";

    private final TelnyxSettings settings;
    private final ObjectMapper objectMapper;
    private final HttpClient client;
    private final Duration requestTimeout;

    @Inject
    public TelnyxOutboundSender(CommsHubProperties properties, ObjectMapper objectMapper) {
        this(properties.telnyxSettings(), objectMapper);
    }

    public TelnyxOutboundSender(TelnyxSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.requestTimeout = Duration.ofMillis(Math.max(1000, settings.httpTimeoutMs()));
        this.client = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public boolean configured() {
        return settings.configured();
    }

    @Override
    public String send(OutboundChannel channel, String recipient, String body, String mediaUrl) {
        if (!settings.configured()) {
            throw new ConfigurationException("Не настроен API-ключ Telnyx");
        }

        Map<String, Object> request = new LinkedHashMap<>();
        String path;
        switch (channel) {
            case SMS -> {
                path = "/messages";
                request.put("from", settings.fromNumber());
                request.put("to", recipient);
                request.put("text", body);
                if (settings.messagingProfileId() != null && !settings.messagingProfileId().isBlank()) {
                    request.put("messaging_profile_id", settings.messagingProfileId());
                }
            }
            case FAX -> {
                if (mediaUrl == null || mediaUrl.isBlank()) {
                    throw new IllegalArgumentException("Для факса обязателен media_url");
                }
                path = "/faxes";
                request.put("connection_id", settings.connectionId());
                request.put("to", recipient);
                request.put("from", settings.fromNumber());
                request.put("media_url", mediaUrl);
            }
            case VOICE -> {
                path = "/calls";
                request.put("connection_id", settings.connectionId());
                request.put("to", recipient);
                request.put("from", settings.fromNumber());
            }
            default -> throw new IllegalArgumentException("Неподдерживаемый канал: " + channel);
        }

        HttpResponse<String> resp = post(path, request);
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new OutboundSendException("HTTP_" + status, "Telnyx ответил статусом " + status, status);
        }
        return providerId(resp.body());
    }

    private HttpResponse<String> post(String path, Map<String, Object> request) {
        String json;
        try {
            json = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Запрос к Telnyx не сериализуется в JSON", e);
        }
        String base = settings.baseUrl().endsWith("/")
                ? settings.baseUrl().substring(0, settings.baseUrl().length() - 1)
                : settings.baseUrl();
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(base + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + settings.apiKey())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        try {
            return client.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OutboundSendException("HTTP_CLIENT_ERROR", "Ошибка транспорта Telnyx: " + e.getMessage(), -1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OutboundSendException("HTTP_CLIENT_INTERRUPTED", "Отправка в Telnyx прервана", -1);
        }
    }

    private String providerId(String body) {
        try {
            JsonNode root = objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
            JsonNode id = root.path("data").path("id");
            if (id.isMissingNode() || id.isNull() || id.asText().isBlank()) {
                throw new OutboundSendException("NO_PROVIDER_ID", "Ответ Telnyx не содержит data.id", 200);
            }
            return id.asText();
        } catch (JsonProcessingException e) {
            throw new OutboundSendException("BAD_RESPONSE", "Ответ Telnyx не является JSON", 200);
        }
    }
}
