package ru.aritmos.studioavailability.scraper.studio246;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.error.ScraperConnectionException;
import ru.aritmos.studioavailability.fetch.FetchRequest;
import ru.aritmos.studioavailability.fetch.FetchResponse;
import ru.aritmos.studioavailability.fetch.ResilientFetchClient;
import ru.aritmos.studioavailability.model.RoomAvailability;
import ru.aritmos.studioavailability.scraper.AbstractStudioScraper;
import ru.aritmos.studioavailability.scraper.RoomGrid;
import ru.aritmos.studioavailability.scraper.ScheduleParser;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Коннектор Studio246.
 * <p>
 * Handshake: {@code GET /reserve/?si=<shopId>} с получением {@code PHPSESSID}.
 * Расписание: AJAX {@code POST /reserve/ajax/ajax_timeline_contents.php}.
 */
public class Studio246Scraper extends AbstractStudioScraper {

    public static final String SOURCE_ID = "studio246";
    public static final String DEFAULT_BASE_URL = "https://www.studio246.net/reserve";

    private static final Logger log = LoggerFactory.getLogger(Studio246Scraper.class);
    private static final String SESSION_COOKIE = "PHPSESSID";

    private final String baseUrl;
    private final ScheduleParser parser;

    private String sessionId;
    private String shopId;

    public Studio246Scraper(ResilientFetchClient fetchClient) {
        this(fetchClient, DEFAULT_BASE_URL);
    }

    public Studio246Scraper(ResilientFetchClient fetchClient, String baseUrl) {
        super(SOURCE_ID, fetchClient);
        this.baseUrl = stripSlash(baseUrl);
        this.parser = new Studio246TimelineParser();
    }

    @Override
    public boolean establishConnection(String shopId) {
        if (shopId == null || shopId.isBlank()) {
            throw new ScraperConnectionException("studio246: не задан идентификатор магазина");
        }
        String url = baseUrl + "/?si=" + URLEncoder.encode(shopId.trim(), StandardCharsets.UTF_8);
        FetchResponse response = fetch(FetchRequest.get(url));
        String sid = response.cookie(SESSION_COOKIE)
                .orElseThrow(() -> new ScraperConnectionException("studio246: источник не выдал идентификатор сессии"));
        this.sessionId = sid;
        this.shopId = shopId.trim();
        log.info("studio246: сессия для магазина {} установлена", this.shopId);
        return true;
    }

    @Override
    public List<RoomAvailability> fetchAvailableTimes(LocalDate date) {
        requireSession(sessionId != null, sourceId);

        Map<String, String> form = new LinkedHashMap<>();
        form.put("si", shopId);
        form.put("date", date.toString());
        FetchRequest request = FetchRequest.post(baseUrl + "/ajax/ajax_timeline_contents.php", form)
                .withHeader("X-Requested-With", "XMLHttpRequest")
                .withHeader("Cookie", cookieHeader(Map.of(SESSION_COOKIE, sessionId)));

        String html = fetchBody(request, "studio246: таймлайн");
        return toRoomAvailabilities(parser.parse(html, date), date);
    }

    @Override
    protected RoomGrid gridFor(String roomName) {
        return RoomGrid.of(Studio246TimelineParser.gridMinute(roomName), false);
    }
}
