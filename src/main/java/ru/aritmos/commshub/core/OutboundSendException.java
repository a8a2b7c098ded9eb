package ru.aritmos.commshub.core;

/**
 * Ошибка провайдера или транспорта при исходящей отправке.
 * <p>
 * Автоматический повтор не выполняется: платная отправка повторяется только решением оператора.
 */
public class OutboundSendException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public OutboundSendException(String errorCode, String message, int httpStatus) {
        super(SensitiveDataSanitizer.sanitizeText(message));
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public String errorCode() {
        return errorCode;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
