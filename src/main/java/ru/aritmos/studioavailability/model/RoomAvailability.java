package ru.aritmos.studioavailability.model;

import ru.aritmos.studioavailability.error.ScraperValidationException;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Доступность одной комнаты на дату в канонической модели.
 * <p>
 * Слоты могут пересекаться, соприкасаться и идти в любом порядке: нормализацией занимается
 * {@link ru.aritmos.studioavailability.matching.AvailabilityMatcher}.
 *
 * @param roomName название комнаты в источнике
 * @param date дата
 * @param slots «сырые» интервалы
 * @param startMinutes сетка минут старта внутри часа (подмножество {0, 15, 30, 45}, не пустое)
 * @param allowsSubHourGranularity разрешено ли бронирование получасовыми единицами
 */
public record RoomAvailability(String roomName,
                               LocalDate date,
                               List<TimeSlot> slots,
                               SortedSet<Integer> startMinutes,
                               boolean allowsSubHourGranularity) {

    public static final Set<Integer> ALLOWED_START_MINUTES = Set.of(0, 15, 30, 45);

    public RoomAvailability {
        if (roomName == null || roomName.isBlank()) {
            throw new ScraperValidationException("Не задано название комнаты");
        }
        if (date == null) {
            throw new ScraperValidationException("Не задана дата для комнаты " + roomName);
        }
        slots = slots == null ? List.of() : List.copyOf(slots);
        startMinutes = validateGrid(roomName, startMinutes);
    }

    public static RoomAvailability of(String roomName,
                                      LocalDate date,
                                      List<TimeSlot> slots,
                                      Collection<Integer> startMinutes,
                                      boolean allowsSubHourGranularity) {
        return new RoomAvailability(roomName, date, slots,
                startMinutes == null ? null : new TreeSet<>(startMinutes), allowsSubHourGranularity);
    }

    /**
     * Копия с другим набором слотов (остальные поля сохраняются).
     */
    public RoomAvailability withSlots(List<TimeSlot> newSlots) {
        return new RoomAvailability(roomName, date, newSlots, startMinutes, allowsSubHourGranularity);
    }

    private static SortedSet<Integer> validateGrid(String roomName, SortedSet<Integer> grid) {
        if (grid == null || grid.isEmpty()) {
            throw new ScraperValidationException("Пустая сетка минут старта для комнаты " + roomName);
        }
        for (Integer m : grid) {
            if (m == null || !ALLOWED_START_MINUTES.contains(m)) {
                throw new ScraperValidationException("Недопустимая минута старта " + m + " для комнаты " + roomName
                        + ". Допустимо: 0, 15, 30, 45");
            }
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(grid));
    }
}
