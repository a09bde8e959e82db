package ru.aritmos.studioavailability.model;

import java.time.LocalTime;

/**
 * Окно поиска, заданное пользователем. Те же правила полуночи и порядка, что у {@link TimeSlot}.
 */
public record DesiredRange(LocalTime start, LocalTime end) {

    public DesiredRange {
        TimeOfDay.requireOrdered(start, end, "Диапазон поиска");
    }

    public static DesiredRange parse(String start, String end) {
        return new DesiredRange(TimeOfDay.parse(start, false), TimeOfDay.parse(end, true));
    }

    public int startMinutes() {
        return TimeOfDay.toMinutes(start, false);
    }

    public int endMinutes() {
        return TimeOfDay.toMinutes(end, true);
    }
}
