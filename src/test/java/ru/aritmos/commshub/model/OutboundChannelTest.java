package ru.aritmos.commshub.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OutboundChannelTest {

    @Test
    void parse_shouldAcceptKnownChannelsCaseInsensitive() {
        assertEquals(OutboundChannel.SMS, OutboundChannel.parse("sms"));
        assertEquals(OutboundChannel.FAX, OutboundChannel.parse(" FAX "));
        assertEquals("voice", OutboundChannel.VOICE.code());
    }

    @Test
    void parse_shouldRejectUnknownChannel() {
        assertThrows(IllegalArgumentException.class, () -> OutboundChannel.parse("pager"));
        assertThrows(IllegalArgumentException.class, () -> OutboundChannel.parse(" "));
    }

    @Test
    void deliveryStatus_shouldRoundTripCodes() {
        assertEquals("retry_queued", DeliveryStatus.RETRY_QUEUED.code());
        assertEquals(DeliveryStatus.SENT, DeliveryStatus.fromCode("sent"));
    }

    @Test
    void systemActor_shouldFallBackToAnonymousUser() {
        assertEquals("user:anonymous", SystemActor.user(" ").label());
        assertEquals("user:u-7", SystemActor.user("u-7").label());
        assertEquals("system:telnyx-webhook", SystemActor.TELNYX_WEBHOOK.label());
    }
}
