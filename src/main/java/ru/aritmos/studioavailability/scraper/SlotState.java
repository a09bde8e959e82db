package ru.aritmos.studioavailability.scraper;

/**
 * Состояние ячейки расписания в источнике.
 */
public enum SlotState {
    AVAILABLE,
    BOOKED,
    CLOSED
}
