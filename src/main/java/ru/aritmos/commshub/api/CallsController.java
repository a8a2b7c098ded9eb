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
import ru.aritmos.commshub.calls.CommsCallService;
import ru.aritmos.commshub.model.CallCreateRequest;
import ru.aritmos.commshub.model.CallLog;
import ru.aritmos.commshub.model.TranscriptRequest;
import ru.aritmos.commshub.model.VoicePlanRequest;
import ru.aritmos.commshub.policy.DecisionPacket;
import ru.aritmos.commshub.security.CommsRoles;
import ru.aritmos.commshub.security.TenantResolver;

import java.util.Map;

/**
 * API звонков: регистрация и чтение агрегатов, таймлайн, привязка, стенограммы, записи и голосовой вывод.
 * <p>
 * Организацию и пользователя для аудита определяет {@link TenantResolver}.
 * Звонок чужой организации неотличим от отсутствующего (404).
 */
@Controller("/api/comms")
@Secured({CommsRoles.READONLY, CommsRoles.OPERATOR, CommsRoles.ADMIN})
@Tag(name = "Comms: звонки", description = "Агрегаты звонков, таймлайн, стенограммы и записи")
public class CallsController {

    private final CommsCallService callService;
    private final TenantResolver tenants;

    @Inject
    public CallsController(CommsCallService callService, TenantResolver tenants) {
        this.callService = callService;
        this.tenants = tenants;
    }

    @Get(uri = "/calls")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Список звонков организации", description = "Новые первыми.")
    public HttpResponse<?> list(@Nullable @QueryValue("limit") Integer limit, HttpRequest<?> request) {
        try {
            return HttpResponse.ok(callService.list(tenants.resolve(request).orgId(), limit == null ? 100 : limit));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
    }

    @Secured({CommsRoles.OPERATOR, CommsRoles.ADMIN})
    @Post(uri = "/calls", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Зарегистрировать звонок", description = "Ручная регистрация. Последующие webhook-события с тем же внешним id дополняют этот агрегат.")
    @ApiResponse(responseCode = "201", description = "Звонок создан", content = @Content(schema = @Schema(implementation = CallLog.class)))
    @ApiResponse(responseCode = "422", description = "Не указаны caller/recipient или внешний id уже занят")
    public HttpResponse<?> create(@Body CallCreateRequest body, HttpRequest<?> request) {
        try {
            TenantResolver.Tenant tenant = tenants.resolve(request);
            return HttpResponse.status(HttpStatus.CREATED).body(callService.createCall(tenant.orgId(), tenant.actor(), body));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.UNPROCESSABLE_ENTITY);
        }
    }

    @Secured({CommsRoles.OPERATOR, CommsRoles.ADMIN})
    @Post(uri = "/calls/outbound", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Зарегистрировать исходящий звонок", description = "Агрегат создаётся в состоянии INITIATED, провайдер не вызывается.")
    @ApiResponse(responseCode = "201", description = "Звонок создан", content = @Content(schema = @Schema(implementation = CallLog.class)))
    @ApiResponse(responseCode = "422", description = "Не указаны caller/recipient или внешний id уже занят")
    public HttpResponse<?> initiateOutbound(@Body CallCreateRequest body, HttpRequest<?> request) {
        try {
            TenantResolver.Tenant tenant = tenants.resolve(request);
            return HttpResponse.status(HttpStatus.CREATED).body(callService.initiateOutbound(tenant.orgId(), tenant.actor(), body));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.UNPROCESSABLE_ENTITY);
        }
    }

    @Get(uri = "/calls/{id}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Звонок по id")
    @ApiResponse(responseCode = "200", description = "Агрегат звонка", content = @Content(schema = @Schema(implementation = CallLog.class)))
    @ApiResponse(responseCode = "404", description = "Звонок не найден")
    public HttpResponse<?> get(@PathVariable("id") long id, HttpRequest<?> request) {
        try {
            return HttpResponse.ok(callService.get(tenants.resolve(request).orgId(), id));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
    }

    @Get(uri = "/calls/{externalCallId}/timeline")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Таймлайн звонка", description = "События по времени провайдера (неизвестное время в конце), затем по порядку приёма.")
    public HttpResponse<?> timeline(@PathVariable("externalCallId") String externalCallId, HttpRequest<?> request) {
        try {
            return HttpResponse.ok(callService.timeline(tenants.resolve(request).orgId(), externalCallId));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
    }

    @Get(uri = "/calls/{id}/recordings")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Записи звонка")
    public HttpResponse<?> recordings(@PathVariable("id") long id, HttpRequest<?> request) {
        try {
            return HttpResponse.ok(callService.recordings(tenants.resolve(request).orgId(), id));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
    }

    @Secured({CommsRoles.OPERATOR, CommsRoles.ADMIN})
    @Post(uri = "/calls/{id}/link", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Привязать звонок к объекту", description = "Задаёт объект предметной области и классификацию (от неё зависит политика хранения).")
    public HttpResponse<?> link(@PathVariable("id") long id, @Body LinkRequest body, HttpRequest<?> request) {
        try {
            if (body == null) {
                throw new IllegalArgumentException("Пустое тело запроса");
            }
            TenantResolver.Tenant tenant = tenants.resolve(request);
            return HttpResponse.ok(callService.link(tenant.orgId(), tenant.actor(), id,
                    body.objectType(), body.objectId(), body.classification()));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
    }

    @Secured({CommsRoles.OPERATOR, CommsRoles.ADMIN})
    @Post(uri = "/calls/{id}/transcript", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Создать стенограмму звонка",
            description = "При активном legal hold запись не выполняется. Уверенность ниже порога даёт REQUIRE_CONFIRMATION.")
    @ApiResponse(responseCode = "200", description = "Стенограмма сохранена вместе с пакетом решения",
            content = @Content(schema = @Schema(implementation = CommsCallService.TranscriptResult.class)))
    @ApiResponse(responseCode = "423", description = "Legal hold: пакет решения BLOCK",
            content = @Content(schema = @Schema(implementation = DecisionPacket.class)))
    public HttpResponse<?> transcript(@PathVariable("id") long id, @Body TranscriptRequest body, HttpRequest<?> request) {
        try {
            TenantResolver.Tenant tenant = tenants.resolve(request);
            return HttpResponse.ok(callService.createTranscript(tenant.orgId(), tenant.actor(), id, body));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.UNPROCESSABLE_ENTITY);
        }
    }

    @Secured({CommsRoles.OPERATOR, CommsRoles.ADMIN})
    @Get(uri = "/recordings/{id}/download")
    @Operation(summary = "Получить запись разговора",
            description = "audio/mpeg из хранилища, иначе ссылка провайдера. При активном legal hold хранилище не читается.")
    @ApiResponse(responseCode = "200", description = "Содержимое записи или ссылка")
    @ApiResponse(responseCode = "404", description = "Запись не найдена или недоступна")
    @ApiResponse(responseCode = "423", description = "Legal hold: пакет решения BLOCK",
            content = @Content(schema = @Schema(implementation = DecisionPacket.class)))
    public HttpResponse<?> download(@PathVariable("id") long id, HttpRequest<?> request) {
        try {
            TenantResolver.Tenant tenant = tenants.resolve(request);
            CommsCallService.RecordingContent content = callService.download(tenant.orgId(), tenant.actor(), id);
            if (content.hasBytes()) {
                return HttpResponse.ok(content.bytes()).contentType(MediaType.of(content.contentType()));
            }
            return HttpResponse.ok(Map.of("recording_url", content.recordingUrl())).contentType(MediaType.APPLICATION_JSON_TYPE);
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.BAD_REQUEST);
        }
    }

    @Secured({CommsRoles.OPERATOR, CommsRoles.ADMIN})
    @Post(uri = "/voice/plan", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "План голосового вывода",
            description = "Шум выше порога даёт BLOCK, отключённый динамик даёт REQUIRE_CONFIRMATION. Решение возвращается в теле ответа.")
    public HttpResponse<?> voicePlan(@Body VoicePlanRequest body, HttpRequest<?> request) {
        try {
            TenantResolver.Tenant tenant = tenants.resolve(request);
            return HttpResponse.ok(callService.voicePlan(tenant.orgId(), tenant.actor(), body));
        } catch (RuntimeException ex) {
            return ApiRequests.toResponse(ex, HttpStatus.UNPROCESSABLE_ENTITY);
        }
    }

    @Serdeable
    @Schema(name = "CommsCallLinkRequest", description = "Привязка звонка к объекту предметной области")
    public record LinkRequest(
            @Schema(description = "Тип объекта", example = "incident")
            String objectType,
            @Schema(description = "Id объекта", example = "INC-42")
            String objectId,
            @Schema(description = "Классификация звонка", example = "billing")
            String classification
    ) {
    }
}
