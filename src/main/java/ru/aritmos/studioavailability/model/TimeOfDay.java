package ru.aritmos.studioavailability.model;

import ru.aritmos.studioavailability.error.ScraperValidationException;

import java.time.DateTimeException;
import java.time.LocalTime;

/**
 * Операции над временем суток на 24-часовом «круге».
 * <p>
 * Правило полуночи: значение 00:00 в роли <b>конца</b> интервала означает 24:00 (1440 минут),
 * в роли начала это 00:00 (0 минут).
 */
public final class TimeOfDay {

    public static final int MINUTES_PER_DAY = 24 * 60;

    /**
     * Запись конца суток во внешнем формате.
     */
    public static final String END_OF_DAY = "24:00";

    private TimeOfDay() {
        // утилитарный класс
    }

    /**
     * Перевести время в минуты от полуночи.
     *
     * @param t время суток
     * @param isEnd true, если значение используется как конец интервала
     * @return минуты от полуночи; для конца интервала 00:00 возвращается 1440
     */
    public static int toMinutes(LocalTime t, boolean isEnd) {
        int minutes = t.getHour() * 60 + t.getMinute();
        if (isEnd && minutes == 0) {
            return MINUTES_PER_DAY;
        }
        return minutes;
    }

    /**
     * Обратное преобразование: 1440 (и только оно) превращается в 00:00.
     */
    public static LocalTime fromMinutes(int minutes) {
        if (minutes < 0 || minutes > MINUTES_PER_DAY) {
            throw new ScraperValidationException("Минуты вне суток: " + minutes);
        }
        if (minutes == MINUTES_PER_DAY) {
            return LocalTime.MIDNIGHT;
        }
        return LocalTime.of(minutes / 60, minutes % 60);
    }

    /**
     * Разобрать {@code HH:MM}. Значение {@code 24:00} допускается только для конца интервала
     * и переводится в 00:00.
     */
    public static LocalTime parse(String value, boolean isEnd) {
        if (value == null || value.isBlank()) {
            throw new ScraperValidationException("Не задано время (ожидается HH:MM)");
        }
        String v = value.trim().replace('：', ':');
        if (END_OF_DAY.equals(v)) {
            if (!isEnd) {
                throw new ScraperValidationException("24:00 допустимо только как время окончания");
            }
            return LocalTime.MIDNIGHT;
        }
        try {
            String[] parts = v.split(":");
            if (parts.length != 2) {
                throw new ScraperValidationException("Некорректный формат времени: " + value + ". Ожидается HH:MM");
            }
            return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException | DateTimeException e) {
            throw new ScraperValidationException("Некорректный формат времени: " + value + ". Ожидается HH:MM", e);
        }
    }

    /**
     * Сформатировать как {@code HH:MM}; конец интервала в полночь выводится как {@code 24:00}.
     */
    public static String format(LocalTime t, boolean isEnd) {
        if (isEnd && t.equals(LocalTime.MIDNIGHT)) {
            return END_OF_DAY;
        }
        return String.format("%02d:%02d", t.getHour(), t.getMinute());
    }

    static void requireOrdered(LocalTime start, LocalTime end, String what) {
        if (start == null || end == null) {
            throw new ScraperValidationException(what + ": начало и конец обязательны");
        }
        if (toMinutes(start, false) >= toMinutes(end, true)) {
            throw new ScraperValidationException(what + ": начало (" + format(start, false)
                    + ") должно быть раньше конца (" + format(end, true) + ")");
        }
    }
}
