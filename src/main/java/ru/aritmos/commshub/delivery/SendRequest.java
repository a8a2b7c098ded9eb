package ru.aritmos.commshub.delivery;

import io.micronaut.serde.annotation.Serdeable;

/**
 * Запрос на исходящую отправку.
 *
 * @param body текст сообщения (в БД не сохраняется, только обезличенное превью)
 * @param mediaUrl ссылка на документ для факса
 */
@Serdeable
public record SendRequest(String recipient, String body, String mediaUrl) {
}
