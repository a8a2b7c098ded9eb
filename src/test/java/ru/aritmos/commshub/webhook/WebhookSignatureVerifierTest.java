package ru.aritmos.commshub.webhook;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.commshub.config.WebhookSettings;
import ru.aritmos.commshub.core.AuthenticationException;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Arrays;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WebhookSignatureVerifierTest {

    private static final String TIMESTAMP = "1767261600";

    private KeyPair keyPair;
    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() throws Exception {
        keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        String spki = Base64.getEncoder().encodeToString(keyPair.getPublic().getEncoded());
        verifier = new WebhookSignatureVerifier(WebhookSettings.defaults().withPublicKey(spki));
    }

    static String sign(PrivateKey key, String timestamp, byte[] body) throws Exception {
        Signature s = Signature.getInstance("Ed25519");
        s.initSign(key);
        s.update((timestamp + ".").getBytes(StandardCharsets.UTF_8));
        s.update(body);
        return Base64.getEncoder().encodeToString(s.sign());
    }

    @Test
    void verifyDelivery_shouldAcceptValidSignature() throws Exception {
        byte[] body = "{\"data\":{\"event_type\":\"call.answered\"}}".getBytes(StandardCharsets.UTF_8);

        assertDoesNotThrow(() -> verifier.verifyDelivery(body, sign(keyPair.getPrivate(), TIMESTAMP, body), TIMESTAMP));
    }

    @Test
    void verifyDelivery_shouldRejectTamperedBodyAndAcceptFreshSignature() throws Exception {
        byte[] body = "{\"data\":{\"event_type\":\"call.answered\"}}".getBytes(StandardCharsets.UTF_8);
        String signature = sign(keyPair.getPrivate(), TIMESTAMP, body);
        byte[] tampered = Arrays.copyOf(body, body.length);
        tampered[5] = (byte) (tampered[5] ^ 0x01);

        assertThrows(AuthenticationException.class, () -> verifier.verifyDelivery(tampered, signature, TIMESTAMP));
        String fresh = sign(keyPair.getPrivate(), TIMESTAMP, tampered);
        assertDoesNotThrow(() -> verifier.verifyDelivery(tampered, fresh, TIMESTAMP));
    }

    @Test
    void verifyDelivery_shouldBindTimestamp() throws Exception {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        String signature = sign(keyPair.getPrivate(), TIMESTAMP, body);

        assertThrows(AuthenticationException.class, () -> verifier.verifyDelivery(body, signature, "1767261601"));
    }

    @Test
    void verifyDelivery_shouldRejectMissingHeadersAndKey() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        assertThrows(AuthenticationException.class, () -> verifier.verifyDelivery(body, null, TIMESTAMP));
        assertThrows(AuthenticationException.class, () -> verifier.verifyDelivery(body, "c2ln", " "));
        assertThrows(AuthenticationException.class, () -> verifier.verifyDelivery(body, "%%%", TIMESTAMP));

        WebhookSignatureVerifier noKey = new WebhookSignatureVerifier(WebhookSettings.defaults());
        assertThrows(AuthenticationException.class, () -> noKey.verifyDelivery(body, "c2ln", TIMESTAMP));
    }

    @Test
    void verifyDelivery_shouldSkipCheckWhenDisabled() {
        WebhookSignatureVerifier relaxed = new WebhookSignatureVerifier(WebhookSettings.defaults().withRequireSignature(false));

        assertFalse(relaxed.signatureRequired());
        assertDoesNotThrow(() -> relaxed.verifyDelivery("{}".getBytes(StandardCharsets.UTF_8), null, null));
    }

    @Test
    void parsePublicKey_shouldAcceptRawThirtyTwoBytes() throws Exception {
        byte[] encoded = keyPair.getPublic().getEncoded();
        byte[] raw = Arrays.copyOfRange(encoded, encoded.length - 32, encoded.length);
        WebhookSignatureVerifier rawKeyVerifier = new WebhookSignatureVerifier(
                WebhookSettings.defaults().withPublicKey(Base64.getEncoder().encodeToString(raw)));
        byte[] body = "{\"x\":1}".getBytes(StandardCharsets.UTF_8);

        assertDoesNotThrow(() -> rawKeyVerifier.verifyDelivery(body, sign(keyPair.getPrivate(), TIMESTAMP, body), TIMESTAMP));
    }

    @Test
    void parsePublicKey_shouldRejectGarbage() {
        assertThrows(IllegalArgumentException.class, () -> WebhookSignatureVerifier.parsePublicKey("not-base64!"));
        assertThrows(IllegalArgumentException.class,
                () -> WebhookSignatureVerifier.parsePublicKey(Base64.getEncoder().encodeToString(new byte[7])));
    }
}
