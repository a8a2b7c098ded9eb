package ru.aritmos.commshub.api;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.security.annotation.Secured;
import io.micronaut.security.rules.SecurityRule;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.config.CommsHubProperties;
import ru.aritmos.commshub.config.WebhookSettings;
import ru.aritmos.commshub.core.AuthenticationException;
import ru.aritmos.commshub.core.CorrelationContext;
import ru.aritmos.commshub.core.SensitiveDataSanitizer;
import ru.aritmos.commshub.webhook.WebhookIngestionService;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Приём webhook-доставок Telnyx (звонки: жизненный цикл, DTMF, записи).
 * <p>
 * Важно:
 * <ul>
 *   <li>подпись проверяется по исходным байтам тела;</li>
 *   <li>мягкие пропуски ({@code no_org}, {@code module_disabled}) отвечают 200, иначе провайдер повторит доставку;</li>
 *   <li>тело и подпись не логируются.</li>
 * </ul>
 */
@Controller("/api/comms/webhooks")
@Secured(SecurityRule.IS_ANONYMOUS)
@Tag(name = "Comms: webhook провайдера", description = "Приём событий звонков Telnyx")
public class CommsWebhookController {

    private static final Logger log = LoggerFactory.getLogger(CommsWebhookController.class);

    private final WebhookIngestionService ingestionService;
    private final WebhookSettings settings;

    @Inject
    public CommsWebhookController(WebhookIngestionService ingestionService, CommsHubProperties properties) {
        this.ingestionService = ingestionService;
        this.settings = properties.webhookSettings();
    }

    @Post(uri = "/telnyx", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Принять событие звонка Telnyx",
            description = "Проверяет подпись Ed25519 над строкой <timestamp>.<body>, нормализует тип события и " +
                    "идемпотентно применяет его к агрегату звонка. Повторная доставка того же события не создаёт новой записи таймлайна."
    )
    @ApiResponse(responseCode = "200", description = "Событие применено (ok) или мягко пропущено (no_org, module_disabled)",
            content = @Content(schema = @Schema(implementation = WebhookIngestionService.Outcome.class)))
    @ApiResponse(responseCode = "401", description = "Подпись отсутствует, не настроен ключ или подпись не сошлась")
    @ApiResponse(responseCode = "400", description = "Тело не является JSON-объектом")
    @ApiResponse(responseCode = "500", description = "Ошибка хранилища; провайдер повторит доставку")
    public HttpResponse<?> telnyx(@Body byte[] body, HttpRequest<?> request) {
        Map<String, String> headers = new LinkedHashMap<>();
        request.getHeaders().forEach((name, values) -> headers.put(name, String.join(",", values)));
        CorrelationContext ctx = CorrelationContext.fromHeaders(headers);
        if (log.isDebugEnabled()) {
            log.debug("[WEBHOOK] delivery headers={} corr={}", SensitiveDataSanitizer.sanitizeHeaders(headers), ctx.correlationId());
        }
        MutableHttpResponse<?> response;
        try {
            WebhookIngestionService.Outcome outcome = ingestionService.ingest(
                    body,
                    request.getHeaders().get(settings.signatureHeader()),
                    request.getHeaders().get(settings.timestampHeader()),
                    ctx.correlationId());
            response = HttpResponse.ok(outcome);
        } catch (AuthenticationException ex) {
            log.warn("[WEBHOOK] rejected: {} corr={}", ex.getMessage(), ctx.correlationId());
            response = HttpResponse.status(HttpStatus.UNAUTHORIZED).body(new ApiError("UNAUTHORIZED", ex.getMessage()));
        } catch (IllegalArgumentException ex) {
            log.warn("[WEBHOOK] bad request: {} corr={}", SensitiveDataSanitizer.sanitizeText(ex.getMessage()), ctx.correlationId());
            response = HttpResponse.badRequest(new ApiError("BAD_REQUEST", SensitiveDataSanitizer.sanitizeText(ex.getMessage())));
        } catch (RuntimeException ex) {
            response = ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
        return response.header(CorrelationContext.CORRELATION_HEADER, ctx.correlationId());
    }
}
