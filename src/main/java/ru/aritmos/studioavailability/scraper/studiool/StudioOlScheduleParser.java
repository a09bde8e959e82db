package ru.aritmos.studioavailability.scraper.studiool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ru.aritmos.studioavailability.error.ScraperParseException;
import ru.aritmos.studioavailability.model.TimeOfDay;
import ru.aritmos.studioavailability.scraper.RawSlot;
import ru.aritmos.studioavailability.scraper.ScheduleParser;
import ru.aritmos.studioavailability.scraper.SlotState;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор ответов studi-ol.com.
 * <p>
 * Страница магазина: CSRF-токен из скрытого поля {@code _token} и таблица комнат {@code resources: [...]}.
 * Расписание: JSON-массив свободных получасовых гранул {@code {roomId, start}}; ключ комнаты это её идентификатор.
 */
public class StudioOlScheduleParser implements ScheduleParser {

    static final int GRANULE_MINUTES = 30;

    private static final Pattern TOKEN = Pattern.compile("name=\"_token\"\\s+value=\"([^\"]+)\"");
    private static final Pattern RESOURCES = Pattern.compile("resources:\\s*\\[(.*?)\\]", Pattern.DOTALL);
    private static final Pattern ROOM = Pattern.compile(
            "\\{\\s*id:\\s*['\"](\\d+)['\"]\\s*,\\s*title:\\s*['\"]([^'\"]+)['\"]\\s*\\}");

    private final ObjectMapper objectMapper;

    public StudioOlScheduleParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return CSRF-токен или null, если поле не найдено
     */
    public String extractToken(String html) {
        if (html == null) {
            return null;
        }
        Matcher m = TOKEN.matcher(html);
        return m.find() ? m.group(1) : null;
    }

    /**
     * @return идентификатор комнаты → название, в порядке страницы
     */
    public Map<String, String> extractRooms(String html) {
        Map<String, String> rooms = new LinkedHashMap<>();
        if (html == null) {
            return rooms;
        }
        Matcher block = RESOURCES.matcher(html);
        if (!block.find()) {
            return rooms;
        }
        Matcher m = ROOM.matcher(block.group(1));
        while (m.find()) {
            rooms.put(m.group(1), m.group(2).trim());
        }
        return rooms;
    }

    @Override
    public List<RawSlot> parse(String body, LocalDate date) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ScraperParseException("studio_ol: ответ расписания не является JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new ScraperParseException("studio_ol: ожидался JSON-массив расписания");
        }

        List<RawSlot> out = new ArrayList<>();
        for (JsonNode entry : root) {
            JsonNode roomId = entry.get("roomId");
            JsonNode start = entry.get("start");
            if (roomId == null || roomId.isNull() || start == null || !start.isTextual()) {
                throw new ScraperParseException("studio_ol: запись расписания без roomId/start: " + entry);
            }
            LocalDateTime at = parseDateTime(start.asText());
            if (!at.toLocalDate().equals(date)) {
                continue;
            }
            int from = at.getHour() * 60 + at.getMinute();
            int to = Math.min(from + GRANULE_MINUTES, TimeOfDay.MINUTES_PER_DAY);
            out.add(new RawSlot(roomId.asText(), TimeOfDay.fromMinutes(from), TimeOfDay.fromMinutes(to), SlotState.AVAILABLE));
        }
        return out;
    }

    private static LocalDateTime parseDateTime(String value) {
        String v = value.trim().replace(' ', 'T');
        try {
            return LocalDateTime.parse(v);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(v).toLocalDateTime();
            } catch (DateTimeParseException e2) {
                e2.addSuppressed(e);
                throw new ScraperParseException("studio_ol: некорректное время начала '" + value + "'", e2);
            }
        }
    }
}
