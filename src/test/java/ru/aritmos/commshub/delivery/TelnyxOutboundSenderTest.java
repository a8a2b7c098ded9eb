package ru.aritmos.commshub.delivery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.commshub.config.TelnyxSettings;
import ru.aritmos.commshub.core.ConfigurationException;
import ru.aritmos.commshub.core.OutboundSendException;
import ru.aritmos.commshub.model.OutboundChannel;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TelnyxOutboundSenderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicInteger status = new AtomicInteger(200);

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v2", exchange -> {
            lastPath.set(exchange.getRequestURI().getPath());
            lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] resp = "{\"data\":{\"id\":\"prov-1\"}}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status.get(), resp.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(resp);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private TelnyxOutboundSender sender(String apiKey) {
        String base = "http://127.0.0.1:" + server.getAddress().getPort() + "/v2/";
        return new TelnyxOutboundSender(new TelnyxSettings(apiKey, "+15550000", "mp-1", "conn-1", base, 2000), mapper);
    }

    @Test
    void send_smsShouldPostToMessages() throws Exception {
        String id = sender("KEY-1").send(OutboundChannel.SMS, "+15550001", "hello", null);

        assertEquals("prov-1", id);
        assertEquals("/v2/messages", lastPath.get());
        assertEquals("Bearer KEY-1", lastAuth.get());
        JsonNode body = mapper.readTree(lastBody.get());
        assertEquals("+15550001", body.get("to").asText());
        assertEquals("mp-1", body.get("messaging_profile_id").asText());
    }

    @Test
    void send_faxAndVoiceShouldUseTheirEndpoints() throws Exception {
        sender("KEY-1").send(OutboundChannel.FAX, "+15550001", null, "https://docs/1.pdf");
        assertEquals("/v2/faxes", lastPath.get());
        assertEquals("https://docs/1.pdf", mapper.readTree(lastBody.get()).get("media_url").asText());

        sender("KEY-1").send(OutboundChannel.VOICE, "+15550001", null, null);
        assertEquals("/v2/calls", lastPath.get());
        assertEquals("conn-1", mapper.readTree(lastBody.get()).get("connection_id").asText());
    }

    @Test
    void send_non2xxShouldRaiseTypedError() {
        status.set(422);

        OutboundSendException ex = assertThrows(OutboundSendException.class,
                () -> sender("KEY-1").send(OutboundChannel.SMS, "+15550001", "hello", null));

        assertEquals("HTTP_422", ex.errorCode());
        assertEquals(422, ex.httpStatus());
    }

    @Test
    void send_withoutApiKeyShouldNotCallProvider() {
        assertThrows(ConfigurationException.class,
                () -> sender(" ").send(OutboundChannel.SMS, "+15550001", "hello", null));
        assertEquals(null, lastPath.get());
    }

    @Test
    void toString_shouldNotRevealApiKey() {
        TelnyxSettings settings = new TelnyxSettings("SECRET-KEY", null, null, null, "https://api.telnyx.com/v2", 8000);
        assertEquals(-1, settings.toString().indexOf("SECRET-KEY"));
    }
}
