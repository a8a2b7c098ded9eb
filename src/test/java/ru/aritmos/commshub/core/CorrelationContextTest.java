package ru.aritmos.commshub.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @Test
    void resolve_shouldGenerateBothIdsWhenMissing() {
        CorrelationContext ctx = CorrelationContext.resolve(" ", null);
        assertTrue(ctx.correlationId().startsWith("ch-"));
        assertEquals(ctx.correlationId(), ctx.requestId());
    }

    @Test
    void resolve_shouldReuseProvidedIdAsFallback() {
        CorrelationContext ctx = CorrelationContext.resolve(null, " req-1 ");
        assertEquals("req-1", ctx.correlationId());
        assertEquals("req-1", ctx.requestId());
    }

    @Test
    void fromHeaders_shouldMatchHeaderNamesCaseInsensitively() {
        CorrelationContext ctx = CorrelationContext.fromHeaders(Map.of("x-correlation-id", "corr-h", "X-REQUEST-ID", "req-h"));
        assertEquals("corr-h", ctx.correlationId());
        assertEquals("req-h", ctx.requestId());
    }

    @Test
    void fromHeaders_shouldGenerateForEmptyMap() {
        assertNotNull(CorrelationContext.fromHeaders(Map.of()).correlationId());
    }
}
