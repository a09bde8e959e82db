package ru.aritmos.studioavailability;

import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import ru.aritmos.studioavailability.fetch.FetchProperties;
import ru.aritmos.studioavailability.scraper.ScraperRegistry;
import ru.aritmos.studioavailability.scraper.ScraperStatus;
import ru.aritmos.studioavailability.service.StudioCatalog;
import ru.aritmos.studioavailability.service.StudioConfig;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@MicronautTest
class ApplicationStartupTest {

    @Inject
    ScraperRegistry registry;

    @Inject
    StudioCatalog studios;

    @Inject
    FetchProperties fetchProperties;

    @Test
    void sourcesAreRegisteredAndStudiosLoadedOnStartup() {
        assertEquals(List.of("pad_studio", "studio246", "studio_ol"), List.copyOf(registry.list().keySet()));
        registry.list().values().forEach(info -> assertEquals(ScraperStatus.ACTIVE, info.metadata().status()));

        StudioConfig bassOnTop = studios.find("2").orElseThrow();
        assertEquals("studio_ol", bassOnTop.scraperType());
        assertEquals("673", bassOnTop.shopId());
        assertEquals("pad_studio", studios.find("1").orElseThrow().scraperType());
        assertEquals(5, fetchProperties.getMaxAttempts());
    }
}
