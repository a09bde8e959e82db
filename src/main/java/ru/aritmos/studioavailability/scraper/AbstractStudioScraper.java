package ru.aritmos.studioavailability.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.error.ScraperConnectionException;
import ru.aritmos.studioavailability.error.ScraperParseException;
import ru.aritmos.studioavailability.error.ScraperValidationException;
import ru.aritmos.studioavailability.fetch.FetchRequest;
import ru.aritmos.studioavailability.fetch.FetchResponse;
import ru.aritmos.studioavailability.fetch.ResilientFetchClient;
import ru.aritmos.studioavailability.model.RoomAvailability;
import ru.aritmos.studioavailability.model.TimeSlot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Общий каркас коннекторов.
 * <p>
 * Отвечает за:
 * <ul>
 *   <li>выполнение запросов через {@link ResilientFetchClient};</li>
 *   <li>преобразование доступных {@link RawSlot} в {@link RoomAvailability} с сеткой комнаты,
 *       без склейки соседних слотов.</li>
 * </ul>
 */
public abstract class AbstractStudioScraper implements ScraperStrategy {

    private static final Logger log = LoggerFactory.getLogger(AbstractStudioScraper.class);

    protected final String sourceId;
    protected final ResilientFetchClient fetchClient;

    protected AbstractStudioScraper(String sourceId, ResilientFetchClient fetchClient) {
        if (fetchClient == null) {
            throw new IllegalArgumentException("Не задан клиент загрузки для источника " + sourceId);
        }
        this.sourceId = sourceId;
        this.fetchClient = fetchClient;
    }

    /**
     * Сетка старта для комнаты.
     */
    protected abstract RoomGrid gridFor(String roomName);

    /**
     * Человекочитаемое название комнаты по ключу источника. По умолчанию ключ и есть название.
     */
    protected String roomName(String roomKey) {
        return roomKey;
    }

    protected FetchResponse fetch(FetchRequest request) {
        return fetchClient.execute(sourceId, request);
    }

    /**
     * Загрузить страницу и убедиться, что тело не пустое.
     */
    protected String fetchBody(FetchRequest request, String what) {
        FetchResponse response = fetch(request);
        if (!response.hasBody()) {
            throw new ScraperParseException(what + ": источник " + sourceId + " вернул пустой ответ");
        }
        return response.body();
    }

    protected static void requireSession(boolean condition, String sourceId) {
        if (!condition) {
            throw new ScraperConnectionException("Сессия с источником " + sourceId
                    + " не установлена: сначала вызовите establishConnection");
        }
    }

    /**
     * Значение заголовка {@code Cookie} или null, если cookie нет.
     */
    protected static String cookieHeader(Map<String, String> cookies) {
        if (cookies == null || cookies.isEmpty()) {
            return null;
        }
        StringJoiner j = new StringJoiner("; ");
        cookies.forEach((k, v) -> j.add(k + "=" + v));
        return j.toString();
    }

    protected static String stripSlash(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Не задан базовый URL источника");
        }
        String u = url.trim();
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }

    /**
     * Сгруппировать доступные ячейки по комнатам в порядке первого появления.
     * Недоступные ячейки и ячейки с некорректным порядком времени пропускаются.
     */
    protected List<RoomAvailability> toRoomAvailabilities(List<RawSlot> rawSlots, LocalDate date) {
        Map<String, List<TimeSlot>> byRoom = new LinkedHashMap<>();
        int skipped = 0;
        for (RawSlot raw : rawSlots) {
            if (raw == null || !raw.isAvailable()) {
                continue;
            }
            try {
                TimeSlot slot = new TimeSlot(raw.start(), raw.end());
                byRoom.computeIfAbsent(roomName(raw.roomKey()), k -> new ArrayList<>()).add(slot);
            } catch (ScraperValidationException e) {
                skipped++;
                log.debug("[{}] пропущена ячейка {}: {}", sourceId, raw, e.getMessage());
            }
        }
        if (skipped > 0) {
            log.warn("[{}] пропущено ячеек с некорректным временем: {}", sourceId, skipped);
        }

        List<RoomAvailability> out = new ArrayList<>();
        for (Map.Entry<String, List<TimeSlot>> e : byRoom.entrySet()) {
            RoomGrid grid = gridFor(e.getKey());
            out.add(new RoomAvailability(e.getKey(), date, e.getValue(), grid.startMinutes(), grid.allowsSubHourGranularity()));
        }
        log.info("[{}] доступность на {}: комнат={}, слотов={}", sourceId, date, out.size(),
                out.stream().mapToInt(r -> r.slots().size()).sum());
        return out;
    }
}
