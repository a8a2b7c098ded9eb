package ru.aritmos.commshub.delivery;

import ru.aritmos.commshub.model.OutboundChannel;

/**
 * Узкий интерфейс исходящей отправки через провайдера.
 * <p>
 * Ядро и тесты зависят только от него, а не от сетевого клиента провайдера.
 */
public interface OutboundSender {

    /**
     * Имя провайдера для истории попыток.
     */
    String providerName();

    /**
     * Отправить сообщение.
     *
     * @param mediaUrl ссылка на документ (обязательна для факса)
     * @return id сообщения у провайдера
     * @throws ru.aritmos.commshub.core.ConfigurationException не настроены учётные данные
     * @throws ru.aritmos.commshub.core.OutboundSendException ошибка провайдера или транспорта
     * @throws IllegalArgumentException не выполнено предусловие канала
     */
    String send(OutboundChannel channel, String recipient, String body, String mediaUrl);

    boolean configured();
}
