package ru.aritmos.commshub.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.serde.annotation.Serdeable;
import io.micronaut.security.annotation.Secured;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;
import ru.aritmos.commshub.core.NotFoundException;
import ru.aritmos.commshub.delivery.DeliveryAttemptTracker;
import ru.aritmos.commshub.delivery.OutboundSendService;
import ru.aritmos.commshub.delivery.SendRequest;
import ru.aritmos.commshub.model.CommsEvent;
import ru.aritmos.commshub.model.DeliveryAttempt;
import ru.aritmos.commshub.model.OutboundChannel;
import ru.aritmos.commshub.security.CommsRoles;
import ru.aritmos.commshub.security.TenantResolver;

import java.util.List;

/**
 * Исходящие отправки (SMS, факс, звонок), очередь доставки и ручной повтор.
 */
@Controller("/api/comms")
@Secured({CommsRoles.OPERATOR, CommsRoles.ADMIN})
@Tag(name = "Comms: исходящие", description = "Отправка через провайдера и история попыток")
public class OutboundController {

    private final OutboundSendService sendService;
    private final DeliveryAttemptTracker tracker;
    private final TenantResolver tenants;

    @Inject
    public OutboundController(OutboundSendService sendService, DeliveryAttemptTracker tracker, TenantResolver tenants) {
        this.sendService = sendService;
        this.tracker = tracker;
        this.tenants = tenants;
    }

    @Post(uri = "/send/{channel}", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Отправить SMS, факс или звонок",
            description = "Event создаётся до вызова провайдера, исход каждой попытки сохраняется. Автоматического повтора нет.")
    @ApiResponse(responseCode = "201", description = "Отправлено",
            content = @Content(schema = @Schema(implementation = OutboundSendService.SendResult.class)))
    @ApiResponse(responseCode = "412", description = "Не настроены учётные данные провайдера (попытка записана как failed)")
    @ApiResponse(responseCode = "422", description = "Неверный запрос (например, факс без media_url)")
    @ApiResponse(responseCode = "502", description = "Ошибка провайдера (попытка записана как failed)")
    public HttpResponse<?> send(@PathVariable("channel") String channel, @Body SendRequest body, HttpRequest<?> request) {
        try {
            TenantResolver.Tenant tenant = tenants.resolve(request);
            OutboundSendService.SendResult result = sendService.send(
                    tenant.orgId(), tenant.actor(), OutboundChannel.parse(channel), body);
            return HttpResponse.status(HttpStatus.CREATED).body(result);
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.UNPROCESSABLE_ENTITY);
        }
    }

    @Post(uri = "/events/{id}/retry")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Поставить событие на повтор", description = "Выставляет статус retry_queued; провайдер не вызывается.")
    public HttpResponse<?> retry(@PathVariable("id") long id, HttpRequest<?> request) {
        try {
            TenantResolver.Tenant tenant = tenants.resolve(request);
            CommsEvent event = sendService.retry(tenant.orgId(), tenant.actor(), id);
            return HttpResponse.ok(new RetryResult(event.id(), event.status()));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
    }

    @Secured({CommsRoles.READONLY, CommsRoles.OPERATOR, CommsRoles.ADMIN})
    @Get(uri = "/queue")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Очередь доставки", description = "События и попытки организации, новые первыми.")
    public HttpResponse<?> queue(@Nullable @QueryValue("limit") Integer limit, HttpRequest<?> request) {
        try {
            long orgId = tenants.resolve(request).orgId();
            int lim = limit == null ? 200 : limit;
            return HttpResponse.ok(new QueueView(tracker.listEvents(orgId, lim), tracker.listAttempts(orgId, lim)));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
    }

    @Secured({CommsRoles.READONLY, CommsRoles.OPERATOR, CommsRoles.ADMIN})
    @Get(uri = "/events/{id}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Событие доставки с историей попыток")
    public HttpResponse<?> event(@PathVariable("id") long id, HttpRequest<?> request) {
        try {
            CommsEvent event = tracker.get(tenants.resolve(request).orgId(), id)
                    .orElseThrow(() -> new NotFoundException("comms_event", "Событие доставки не найдено"));
            return HttpResponse.ok(event);
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
    }

    @Serdeable
    @Schema(name = "CommsQueueView", description = "События исходящей доставки и их попытки")
    public record QueueView(List<CommsEvent> events, List<DeliveryAttempt> attempts) {
    }

    @Serdeable
    @Schema(name = "CommsRetryResult", description = "Результат постановки на повтор")
    public record RetryResult(long eventId, String status) {
    }
}
