package ru.aritmos.studioavailability.scraper;

import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * Сетка старта комнаты: допустимые минуты начала брони и признак получасовых бронирований.
 */
public record RoomGrid(SortedSet<Integer> startMinutes, boolean allowsSubHourGranularity) {

    public static final String START_MINUTES = "startMinutes";
    public static final String SUB_HOUR_GRANULARITY = "subHourGranularity";

    public static final RoomGrid ON_THE_HOUR = of(Set.of(0), false);

    public static RoomGrid of(Set<Integer> startMinutes, boolean allowsSubHourGranularity) {
        return new RoomGrid(new TreeSet<>(startMinutes), allowsSubHourGranularity);
    }

    /**
     * Атрибуты сетки для {@link ScraperMetadata#additionalInfo()}.
     */
    public Map<String, String> describe() {
        StringJoiner minutes = new StringJoiner(",");
        startMinutes.forEach(m -> minutes.add(String.valueOf(m)));
        return Map.of(START_MINUTES, minutes.toString(),
                SUB_HOUR_GRANULARITY, String.valueOf(allowsSubHourGranularity));
    }}
