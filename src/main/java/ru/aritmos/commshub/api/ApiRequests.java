package ru.aritmos.commshub.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MutableHttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.commshub.core.AccessDeniedException;
import ru.aritmos.commshub.core.AuthenticationException;
import ru.aritmos.commshub.core.ConfigurationException;
import ru.aritmos.commshub.core.NotFoundException;
import ru.aritmos.commshub.core.OutboundSendException;
import ru.aritmos.commshub.core.SensitiveDataSanitizer;
import ru.aritmos.commshub.policy.PolicyBlockedException;

/**
 * Перевод исключений операций API в HTTP-ответы.
 */
final class ApiRequests {

    private static final Logger log = LoggerFactory.getLogger(ApiRequests.class);

    private ApiRequests() {
    }

    /**
     * Перевести исключение операции в HTTP-ответ.
     *
     * @param badInputStatus статус для {@link IllegalArgumentException} (400 или 422)
     */
    static MutableHttpResponse<?> toResponse(RuntimeException ex, HttpStatus badInputStatus) {
        if (ex instanceof PolicyBlockedException blocked) {
            return HttpResponse.status(HttpStatus.LOCKED).body(blocked.packet());
        }
        if (ex instanceof AuthenticationException) {
            return HttpResponse.unauthorized().body(new ApiError("UNAUTHORIZED", ex.getMessage()));
        }
        if (ex instanceof AccessDeniedException) {
            return HttpResponse.status(HttpStatus.FORBIDDEN).body(new ApiError("FORBIDDEN", ex.getMessage()));
        }
        if (ex instanceof NotFoundException) {
            return HttpResponse.notFound(new ApiError("NOT_FOUND", ex.getMessage()));
        }
        if (ex instanceof ConfigurationException) {
            return HttpResponse.status(HttpStatus.PRECONDITION_FAILED).body(new ApiError("NOT_CONFIGURED", ex.getMessage()));
        }
        if (ex instanceof OutboundSendException send) {
            return HttpResponse.status(HttpStatus.BAD_GATEWAY).body(new ApiError(send.errorCode(), send.getMessage()));
        }
        if (ex instanceof IllegalArgumentException) {
            return HttpResponse.status(badInputStatus).body(new ApiError("BAD_REQUEST", SensitiveDataSanitizer.sanitizeText(ex.getMessage())));
        }
        log.error("[API] request failed err={}", SensitiveDataSanitizer.sanitizeText(ex.toString()), ex);
        return HttpResponse.serverError(new ApiError("INTERNAL_ERROR", "Внутренняя ошибка обработки запроса"));
    }
}
