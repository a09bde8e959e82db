package ru.aritmos.studioavailability.scraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import ru.aritmos.studioavailability.fetch.ResilientFetchClient;
import ru.aritmos.studioavailability.scraper.padstudio.PadStudioScraper;
import ru.aritmos.studioavailability.scraper.studio246.Studio246Scraper;
import ru.aritmos.studioavailability.scraper.studiool.StudioOlScraper;

import java.util.List;
import java.util.Map;

/**
 * Статическая таблица поддерживаемых источников.
 */
@Singleton
public class ScraperCatalog {

    static final String VERSION = "1.0.0";

    /**
     * Минута старта Studio246 задаётся именем комнаты ({@code Room 30} и т.п.).
     */
    static final Map<String, String> PER_ROOM_GRID = Map.of(
            RoomGrid.START_MINUTES, "per-room",
            RoomGrid.SUB_HOUR_GRANULARITY, "false");

    private final ResilientFetchClient fetchClient;
    private final ObjectMapper objectMapper;

    public ScraperCatalog(ResilientFetchClient fetchClient, ObjectMapper objectMapper) {
        this.fetchClient = fetchClient;
        this.objectMapper = objectMapper;
    }

    public List<ScraperRegistration> registrations() {
        return List.of(
                new ScraperRegistration(PadStudioScraper.SOURCE_ID,
                        () -> new PadStudioScraper(fetchClient),
                        ScraperMetadata.of("Система бронирования PAD Studio (reserve1.jp)", VERSION, true,
                                "https://www.reserve1.jp").withInfo(RoomGrid.ON_THE_HOUR.describe())),
                new ScraperRegistration(Studio246Scraper.SOURCE_ID,
                        () -> new Studio246Scraper(fetchClient),
                        ScraperMetadata.of("Система бронирования Studio246", VERSION, false,
                                "https://www.studio246.net").withInfo(PER_ROOM_GRID)),
                new ScraperRegistration(StudioOlScraper.SOURCE_ID,
                        () -> new StudioOlScraper(fetchClient, objectMapper),
                        ScraperMetadata.of("Система бронирования Studio-OL", VERSION, false,
                                StudioOlScraper.DEFAULT_BASE_URL).withInfo(StudioOlScraper.HALF_HOUR.describe()))
        );
    }
}
