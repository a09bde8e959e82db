package ru.aritmos.studioavailability.scraper;

import java.time.LocalDate;
import java.util.List;

/**
 * Разбор разметки конкретного источника в список {@link RawSlot}.
 * <p>
 * Парсер не ходит в сеть и не знает о сетке минут старта: это ответственность коннектора.
 */
public interface ScheduleParser {

    /**
     * @param body тело ответа источника (HTML или JSON)
     * @param date запрошенная дата
     * @return ячейки расписания в порядке источника
     * @throws ru.aritmos.studioavailability.error.ScraperParseException структура ответа не распознана
     */
    List<RawSlot> parse(String body, LocalDate date);
}
