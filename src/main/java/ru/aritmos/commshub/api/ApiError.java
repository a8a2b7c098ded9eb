package ru.aritmos.commshub.api;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Тело ответа об ошибке.
 */
@Serdeable
@Schema(name = "CommsApiError", description = "Ошибка обработки запроса")
public record ApiError(
        @Schema(description = "Код ошибки", example = "NOT_FOUND")
        String error,
        @Schema(description = "Санитизированное описание")
        String message
) {
}
