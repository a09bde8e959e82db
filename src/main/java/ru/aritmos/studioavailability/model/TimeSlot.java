package ru.aritmos.studioavailability.model;

import java.time.LocalTime;

/**
 * Непрерывный интервал, доступный для бронирования.
 * <p>
 * Конец 00:00 трактуется как 24:00. Интервал через полночь не допускается: при создании
 * проверяется {@code start < end} после применения правила полуночи, иначе
 * {@link ru.aritmos.studioavailability.error.ScraperValidationException}.
 */
public record TimeSlot(LocalTime start, LocalTime end) {

    public TimeSlot {
        TimeOfDay.requireOrdered(start, end, "Интервал");
    }

    /**
     * Создать интервал по минутам от полуночи (1440 = конец суток).
     */
    public static TimeSlot ofMinutes(int startMinutes, int endMinutes) {
        return new TimeSlot(TimeOfDay.fromMinutes(startMinutes), TimeOfDay.fromMinutes(endMinutes));
    }

    public static TimeSlot parse(String start, String end) {
        return new TimeSlot(TimeOfDay.parse(start, false), TimeOfDay.parse(end, true));
    }

    public int startMinutes() {
        return TimeOfDay.toMinutes(start, false);
    }

    public int endMinutes() {
        return TimeOfDay.toMinutes(end, true);
    }

    public int durationMinutes() {
        return endMinutes() - startMinutes();
    }

    @Override
    public String toString() {
        return TimeOfDay.format(start, false) + "-" + TimeOfDay.format(end, true);
    }
}
