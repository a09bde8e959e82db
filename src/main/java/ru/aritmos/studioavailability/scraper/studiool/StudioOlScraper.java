package ru.aritmos.studioavailability.scraper.studiool;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.error.ScraperConnectionException;
import ru.aritmos.studioavailability.fetch.FetchRequest;
import ru.aritmos.studioavailability.fetch.FetchResponse;
import ru.aritmos.studioavailability.fetch.ResilientFetchClient;
import ru.aritmos.studioavailability.model.RoomAvailability;
import ru.aritmos.studioavailability.scraper.AbstractStudioScraper;
import ru.aritmos.studioavailability.scraper.RoomGrid;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Коннектор studi-ol.com.
 * <p>
 * Сессия: страница магазина {@code /shop/<shopId>} даёт CSRF-токен, cookie и таблицу комнат.
 * Комнаты бронируются с шагом 30 минут.
 */
public class StudioOlScraper extends AbstractStudioScraper {

    public static final String SOURCE_ID = "studio_ol";
    public static final String DEFAULT_BASE_URL = "https://studi-ol.com";

    private static final Logger log = LoggerFactory.getLogger(StudioOlScraper.class);
    public static final RoomGrid HALF_HOUR = RoomGrid.of(Set.of(0, 30), true);

    private final String baseUrl;
    private final StudioOlScheduleParser parser;

    private String token;
    private String shopId;
    private Map<String, String> cookies = Map.of();
    private Map<String, String> rooms = Map.of();

    public StudioOlScraper(ResilientFetchClient fetchClient, ObjectMapper objectMapper) {
        this(fetchClient, objectMapper, DEFAULT_BASE_URL);
    }

    public StudioOlScraper(ResilientFetchClient fetchClient, ObjectMapper objectMapper, String baseUrl) {
        super(SOURCE_ID, fetchClient);
        this.baseUrl = stripSlash(baseUrl);
        this.parser = new StudioOlScheduleParser(objectMapper);
    }

    @Override
    public boolean establishConnection(String shopId) {
        if (shopId == null || shopId.isBlank()) {
            throw new ScraperConnectionException("studio_ol: не задан идентификатор магазина");
        }
        String id = shopId.trim();
        FetchResponse response = fetch(FetchRequest.get(baseUrl + "/shop/" + URLEncoder.encode(id, StandardCharsets.UTF_8)));

        String t = parser.extractToken(response.body());
        if (t == null) {
            throw new ScraperConnectionException("studio_ol: на странице магазина " + id + " нет CSRF-токена");
        }
        Map<String, String> r = parser.extractRooms(response.body());
        if (r.isEmpty()) {
            log.warn("studio_ol: таблица комнат магазина {} не найдена, будут использованы идентификаторы", id);
        }

        this.token = t;
        this.shopId = id;
        this.cookies = response.cookies();
        this.rooms = r;
        log.info("studio_ol: сессия для магазина {} установлена, комнат={}", id, r.size());
        return true;
    }

    @Override
    public List<RoomAvailability> fetchAvailableTimes(LocalDate date) {
        requireSession(token != null && shopId != null, sourceId);

        String day = date.toString();
        Map<String, String> form = new LinkedHashMap<>();
        form.put("_token", token);
        form.put("shop_id", shopId);
        form.put("start", day + " 00:00:00");
        form.put("end", day + " 23:30:00");

        FetchRequest request = FetchRequest.post(baseUrl + "/get_schedule_shop", form)
                .withHeader("X-Requested-With", "XMLHttpRequest")
                .withHeader("X-CSRF-TOKEN", token);
        String cookie = cookieHeader(cookies);
        if (cookie != null) {
            request = request.withHeader("Cookie", cookie);
        }

        String json = fetchBody(request, "studio_ol: расписание");
        return toRoomAvailabilities(parser.parse(json, date), date);
    }

    @Override
    protected String roomName(String roomKey) {
        return rooms.getOrDefault(roomKey, "Room " + roomKey);
    }

    @Override
    protected RoomGrid gridFor(String roomName) {
        return HALF_HOUR;
    }
}
