package ru.aritmos.commshub.api;

import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Produces;
import io.micronaut.serde.annotation.Serdeable;
import io.micronaut.security.annotation.Secured;
import io.micronaut.security.rules.SecurityRule;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import ru.aritmos.commshub.delivery.OutboundSendService;
import ru.aritmos.commshub.webhook.WebhookSignatureVerifier;

/**
 * Состояние модуля связи без обращения к провайдеру.
 */
@Controller("/api/comms")
@Secured(SecurityRule.IS_ANONYMOUS)
@Tag(name = "Comms: служебное")
public class CommsHealthController {

    private final OutboundSendService sendService;
    private final WebhookSignatureVerifier verifier;

    @Inject
    public CommsHealthController(OutboundSendService sendService, WebhookSignatureVerifier verifier) {
        this.sendService = sendService;
        this.verifier = verifier;
    }

    @Get(uri = "/health")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Состояние интеграции с провайдером",
            description = "configured: есть ли учётные данные; signatureRequired: включена ли проверка подписи webhook.")
    public Health health() {
        boolean configured = sendService.providerConfigured();
        return new Health(configured ? "configured" : "missing_credentials", configured, verifier.signatureRequired(), "skipped");
    }

    @Serdeable
    public record Health(String status, boolean configured, boolean signatureRequired, String probe) {
    }
}
