package ru.aritmos.commshub.model;

import io.micronaut.serde.annotation.Serdeable;

import java.time.Instant;

/**
 * Агрегат звонка: одна строка на физический звонок внутри организации.
 * <p>
 * Строка никогда не удаляется; «закрытый» звонок имеет состояние {@link CallState#ENDED}.
 * Ссылки на события и записи идут только от них к агрегату (по id), обратной коллекции агрегат не держит.
 *
 * @param payloadJson последний увиденный payload провайдера (обновляется и дубликатами)
 * @param classification тег классификации (например, {@code billing}), от него зависит политика хранения
 */
@Serdeable
public record CallLog(long id,
                      long orgId,
                      String externalCallId,
                      String direction,
                      String caller,
                      String recipient,
                      CallState callState,
                      String lastEvent,
                      String dtmfDigits,
                      int durationSeconds,
                      String recordingUrl,
                      String disposition,
                      String classification,
                      String linkedObjectType,
                      String linkedObjectId,
                      Instant answeredAt,
                      Instant endedAt,
                      String payloadJson,
                      Instant createdAt,
                      Instant updatedAt) {

    /**
     * Пустой агрегат для первой доставки по звонку (id ещё не присвоен).
     * Поля события в него вносит {@link #merge(CallLogPatch, boolean, Instant)}.
     */
    public static CallLog shell(long orgId, String externalCallId, Instant now) {
        return new CallLog(0, orgId, emptyToNull(externalCallId), "inbound", null, null,
                CallState.UNKNOWN, null, "", 0, null, null, null, null, null,
                null, null, null, now, now);
    }

    /**
     * Агрегат звонка, зарегистрированного через API (id ещё не присвоен).
     */
    public static CallLog registered(long orgId, CallCreateRequest request, CallState state, Instant now) {
        return new CallLog(0, orgId, emptyToNull(request.externalCallId()), request.direction(),
                request.caller(), request.recipient(), state, null, "", request.durationSeconds(),
                emptyToNull(request.recordingUrl()), request.disposition(), null, null, null,
                null, null, null, now, now);
    }

    /**
     * Слить поля события в агрегат.
     * <p>
     * Правила:
     * <ul>
     *   <li>непустое входящее значение побеждает, пустое ничего не стирает;</li>
     *   <li>{@code callState} меняется только в сторону большего прогресса;</li>
     *   <li>DTMF-цифры дописываются, и только для принятого события;</li>
     *   <li>{@code answeredAt}/{@code endedAt} выставляются один раз, только принятым событием с известным временем;</li>
     *   <li>{@code externalCallId} только заполняется, уже присвоенный не меняется;</li>
     *   <li>{@code lastEvent} и payload обновляются всегда, в том числе дубликатом.</li>
     * </ul>
     * Если слияние ничего не изменило, возвращается этот же экземпляр с прежним {@code updatedAt}.
     *
     * @param patch поля входящего события
     * @param accepted событие принято (не дубликат)
     * @param now время обновления
     * @return агрегат после слияния
     */
    public CallLog merge(CallLogPatch patch, boolean accepted, Instant now) {
        CallState state = CallState.advance(callState, patch.callState());

        String digits = dtmfDigits == null ? "" : dtmfDigits;
        if (accepted && notEmpty(patch.dtmfDigits())) {
            digits = digits + patch.dtmfDigits();
        }

        Instant answered = answeredAt;
        Instant ended = endedAt;
        if (accepted && patch.occurredAt() != null) {
            if (answered == null && patch.callState() == CallState.ANSWERED) {
                answered = patch.occurredAt();
            }
            if (ended == null && patch.callState() == CallState.ENDED) {
                ended = patch.occurredAt();
            }
        }

        int duration = patch.durationSeconds() != null && patch.durationSeconds() > 0
                ? patch.durationSeconds()
                : durationSeconds;

        CallLog merged = new CallLog(
                id,
                orgId,
                externalCallId == null ? emptyToNull(patch.externalCallId()) : externalCallId,
                pick(patch.direction(), direction),
                pick(patch.caller(), caller),
                pick(patch.recipient(), recipient),
                state,
                pick(patch.rawEventType(), lastEvent),
                digits,
                duration,
                pick(patch.recordingUrl(), recordingUrl),
                pick(patch.disposition(), disposition),
                classification,
                linkedObjectType,
                linkedObjectId,
                answered,
                ended,
                patch.payloadJson() == null ? payloadJson : patch.payloadJson(),
                createdAt,
                updatedAt
        );
        return merged.equals(this) ? this : merged.touchedAt(now);
    }

    /**
     * Отметить повтор события, принадлежащего этому звонку, пришедший с чужим внешним id.
     * Обновляются только {@code lastEvent} и payload, остальные поля звонка не трогаются.
     */
    public CallLog touch(String rawEventType, String newPayloadJson, Instant now) {
        CallLog touched = new CallLog(id, orgId, externalCallId, direction, caller, recipient, callState,
                pick(rawEventType, lastEvent), dtmfDigits, durationSeconds, recordingUrl, disposition, classification,
                linkedObjectType, linkedObjectId, answeredAt, endedAt,
                newPayloadJson == null ? payloadJson : newPayloadJson, createdAt, updatedAt);
        return touched.equals(this) ? this : touched.touchedAt(now);
    }

    private CallLog touchedAt(Instant now) {
        return new CallLog(id, orgId, externalCallId, direction, caller, recipient, callState, lastEvent,
                dtmfDigits, durationSeconds, recordingUrl, disposition, classification, linkedObjectType,
                linkedObjectId, answeredAt, endedAt, payloadJson, createdAt, now);
    }

    public CallLog withId(long newId) {
        return new CallLog(newId, orgId, externalCallId, direction, caller, recipient, callState, lastEvent,
                dtmfDigits, durationSeconds, recordingUrl, disposition, classification, linkedObjectType,
                linkedObjectId, answeredAt, endedAt, payloadJson, createdAt, updatedAt);
    }

    public CallLog withLink(String objectType, String objectId, String newClassification, Instant now) {
        return new CallLog(id, orgId, externalCallId, direction, caller, recipient, callState, lastEvent,
                dtmfDigits, durationSeconds, recordingUrl, disposition,
                pick(newClassification, classification),
                pick(objectType, linkedObjectType),
                pick(objectId, linkedObjectId),
                answeredAt, endedAt, payloadJson, createdAt, now);
    }

    /**
     * Ключ классификации для поиска политики хранения.
     */
    public String retentionKey() {
        return "billing".equalsIgnoreCase(classification) ? "comms_billing" : "comms_ops";
    }

    private static String pick(String incoming, String existing) {
        return notEmpty(incoming) ? incoming : existing;
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    private static String emptyToNull(String s) {
        return notEmpty(s) ? s : null;
    }
}
