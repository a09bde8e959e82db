package ru.aritmos.studioavailability.scraper;

import java.time.LocalTime;

/**
 * Ячейка расписания источника до нормализации.
 *
 * @param roomKey ключ комнаты в источнике (название или идентификатор)
 * @param start начало
 * @param end конец (00:00 = конец суток)
 * @param state состояние ячейки
 */
public record RawSlot(String roomKey, LocalTime start, LocalTime end, SlotState state) {

    public boolean isAvailable() {
        return state == SlotState.AVAILABLE;
    }
}
