package ru.aritmos.studioavailability.scraper.studio246;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.error.ScraperParseException;
import ru.aritmos.studioavailability.model.RoomAvailability;
import ru.aritmos.studioavailability.model.TimeOfDay;
import ru.aritmos.studioavailability.scraper.HtmlFragments;
import ru.aritmos.studioavailability.scraper.RawSlot;
import ru.aritmos.studioavailability.scraper.ScheduleParser;
import ru.aritmos.studioavailability.scraper.SlotState;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор AJAX-таймлайна Studio246.
 * <p>
 * Из блоков {@code div.timeline_block} берётся блок с {@code data-date} запрошенной даты, из него ячейки
 * {@code td.time_cell}. Ячейка доступна при {@code state="posi"} и без класса {@code bg_black}.
 * <p>
 * Комната определяется минутой начала ячейки ({@code Room 0}, {@code Room 30} и т.д.), каждая ячейка
 * это бронь на один час, обрезанная полуночью. Время {@code >= 24:00} относится к следующему дню и пропускается.
 */
public class Studio246TimelineParser implements ScheduleParser {

    public static final String ROOM_PREFIX = "Room ";

    private static final Logger log = LoggerFactory.getLogger(Studio246TimelineParser.class);

    private static final Pattern BLOCK_START = Pattern.compile("<div\\b([^>]*)>", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOCK = Pattern.compile("^(\\d{1,2})[:：](\\d{2})$");
    private static final int SLOT_MINUTES = 60;

    @Override
    public List<RawSlot> parse(String body, LocalDate date) {
        if (body == null || body.isBlank()) {
            throw new ScraperParseException("studio246: пустой ответ таймлайна");
        }
        String block = timelineBlock(body, date.toString());
        if (block == null) {
            log.info("studio246: блок таймлайна на {} не найден", date);
            return List.of();
        }

        List<RawSlot> out = new ArrayList<>();
        int nextDay = 0;
        for (String attrs : HtmlFragments.openTags(block, "td")) {
            if (!hasClass(attrs, "time_cell")) {
                continue;
            }
            String time = HtmlFragments.attr(attrs, "data-time");
            if (time == null || time.isBlank()) {
                continue;
            }
            int start = minutesOf(time.trim());
            if (start >= TimeOfDay.MINUTES_PER_DAY) {
                nextDay++;
                continue;
            }
            int minute = start % 60;
            if (!RoomAvailability.ALLOWED_START_MINUTES.contains(minute)) {
                log.debug("studio246: пропущена ячейка {} с нестандартной минутой", time);
                continue;
            }
            int end = Math.min(start + SLOT_MINUTES, TimeOfDay.MINUTES_PER_DAY);
            SlotState state = "posi".equals(HtmlFragments.attr(attrs, "state")) && !hasClass(attrs, "bg_black")
                    ? SlotState.AVAILABLE
                    : SlotState.BOOKED;
            out.add(new RawSlot(roomName(minute), TimeOfDay.fromMinutes(start), TimeOfDay.fromMinutes(end), state));
        }
        if (nextDay > 0) {
            log.debug("studio246: пропущено ячеек следующего дня: {}", nextDay);
        }
        return out;
    }

    public static String roomName(int minute) {
        return ROOM_PREFIX + minute;
    }

    /**
     * Фрагмент от открывающего тега блока нужной даты до следующего блока таймлайна.
     */
    private static String timelineBlock(String body, String isoDate) {
        Matcher m = BLOCK_START.matcher(body);
        int from = -1;
        while (m.find()) {
            String attrs = m.group(1);
            if (!hasClass(attrs, "timeline_block")) {
                continue;
            }
            if (from >= 0) {
                return body.substring(from, m.start());
            }
            if (isoDate.equals(HtmlFragments.attr(attrs, "data-date"))) {
                from = m.end();
            }
        }
        return from >= 0 ? body.substring(from) : null;
    }

    private static boolean hasClass(String attrs, String cls) {
        String c = HtmlFragments.attr(attrs, "class");
        return c != null && Arrays.asList(c.trim().split("\\s+")).contains(cls);
    }

    private static int minutesOf(String time) {
        Matcher m = CLOCK.matcher(time);
        if (!m.matches()) {
            throw new ScraperParseException("studio246: некорректное время ячейки '" + time + "'");
        }
        int h = Integer.parseInt(m.group(1));
        int min = Integer.parseInt(m.group(2));
        if (min >= 60) {
            throw new ScraperParseException("studio246: некорректное время ячейки '" + time + "'");
        }
        return h * 60 + min;
    }

    static Set<Integer> gridMinute(String roomName) {
        if (roomName != null && roomName.startsWith(ROOM_PREFIX)) {
            try {
                return Set.of(Integer.parseInt(roomName.substring(ROOM_PREFIX.length()).trim()));
            } catch (NumberFormatException e) {
                throw new ScraperParseException("studio246: некорректное имя комнаты '" + roomName + "'", e);
            }
        }
        return Set.of(0);
    }
}
