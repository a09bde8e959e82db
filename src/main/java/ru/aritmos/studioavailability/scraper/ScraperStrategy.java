package ru.aritmos.studioavailability.scraper;

import ru.aritmos.studioavailability.model.RoomAvailability;

import java.time.LocalDate;
import java.util.List;

/**
 * Коннектор к системе бронирования одной сети студий.
 * <p>
 * Реализация держит сессию источника (cookie, CSRF-токен, идентификатор магазина) и поэтому
 * <b>не потокобезопасна</b>: экземпляр обслуживает не более одного вызова одновременно.
 * <p>
 * Важно:
 * <ul>
 *   <li>коннектор возвращает «сырые» слоты в том виде, в каком их отдаёт источник (гранулы по 15/30/60 минут),
 *       и не склеивает их; склейка и учёт сетки выполняются один раз в
 *       {@link ru.aritmos.studioavailability.matching.AvailabilityMatcher};</li>
 *   <li>каждая комната сопровождается сеткой минут старта и признаком получасовых бронирований;</li>
 *   <li>токены и cookie не логируются.</li>
 * </ul>
 */
public interface ScraperStrategy {

    /**
     * Установить сессию с источником (handshake, получение токена или cookie).
     *
     * @param shopId идентификатор магазина в источнике или null, если источник его не требует
     * @return true, если сессия установлена
     * @throws ru.aritmos.studioavailability.error.ScraperConnectionException handshake не удался
     * @throws ru.aritmos.studioavailability.error.ScraperAuthenticationException источник отклонил сессию
     */
    boolean establishConnection(String shopId);

    /**
     * Получить доступность комнат на дату.
     *
     * @throws ru.aritmos.studioavailability.error.ScraperParseException ответ источника не разобран
     * @throws ru.aritmos.studioavailability.error.SourceException сетевая ошибка после исчерпания повторов
     */
    List<RoomAvailability> fetchAvailableTimes(LocalDate date);
}
