package ru.aritmos.studioavailability.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.studioavailability.error.ScraperConnectionException;
import ru.aritmos.studioavailability.matching.AvailabilityMatcher;
import ru.aritmos.studioavailability.model.RoomAvailability;
import ru.aritmos.studioavailability.model.TimeSlot;
import ru.aritmos.studioavailability.scraper.ScraperMetadata;
import ru.aritmos.studioavailability.scraper.ScraperRegistry;
import ru.aritmos.studioavailability.scraper.ScraperStatus;
import ru.aritmos.studioavailability.scraper.ScraperStrategy;
import ru.aritmos.studioavailability.service.AvailabilityProperties;
import ru.aritmos.studioavailability.service.AvailabilityService;
import ru.aritmos.studioavailability.service.ConfiguredStudioCatalog;
import ru.aritmos.studioavailability.service.StudioProperties;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class AvailabilityControllerTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ScraperRegistry registry = new ScraperRegistry();
    private final AvailabilityController controller = new AvailabilityController(service());

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void availableRangesUseEndOfDayLiteral() {
        registry.register("studio_ol", () -> new FixedStrategy(List.of(TimeSlot.parse("22:00", "00:00"))),
                ScraperMetadata.of("test", "1.0.0", false, null));

        HttpResponse<?> response = controller.availability("2", "2025-01-07", "23:00", "24:00", "1");

        assertEquals(HttpStatus.OK, response.getStatus());
        AvailabilityResponses.AvailabilityEnvelope body =
                assertInstanceOf(AvailabilityResponses.AvailabilityEnvelope.class, response.body());
        assertEquals("success", body.status());
        assertEquals("2", body.data().studioId());
        assertEquals("Bass On Top", body.data().studioName());
        assertEquals("Asia/Tokyo", body.data().meta().timezone());
        assertEquals(List.of(new AvailabilityResponses.AvailableRange("A", "23:00", "24:00", List.of(0, 30))),
                body.data().availableRanges());
    }

    @Test
    void badParametersAreValidationErrors() {
        assertError(controller.availability("2", "2025-13-40", "10:00", "12:00", "1"), HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
        assertError(controller.availability("2", "2025-01-07", "12:00", "10:00", "1"), HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
        assertError(controller.availability("2", "2025-01-07", "10:00", "12:00", "abc"), HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
        assertError(controller.availability("2", "2025-01-07", "10:00", "12:00", "0"), HttpStatus.BAD_REQUEST, "VALIDATION_ERROR");
    }

    @Test
    void unknownStudioAndSourceAreNotFound() {
        assertError(controller.availability("42", "2025-01-07", "10:00", "12:00", "1"), HttpStatus.NOT_FOUND, "STUDIO_NOT_CONFIGURED");
        assertError(controller.availability("2", "2025-01-07", "10:00", "12:00", "1"), HttpStatus.NOT_FOUND, "SCRAPER_NOT_REGISTERED");
    }

    @Test
    void sourceFailureIsServiceUnavailable() {
        registry.register("studio_ol", () -> new ScraperStrategy() {
            @Override
            public boolean establishConnection(String shopId) {
                throw new ScraperConnectionException("no token for _token=secret");
            }

            @Override
            public List<RoomAvailability> fetchAvailableTimes(LocalDate date) {
                return List.of();
            }
        }, ScraperMetadata.of("test", "1.0.0", false, null));

        HttpResponse<?> response = controller.availability("2", "2025-01-07", "10:00", "12:00", "1");

        AvailabilityResponses.ErrorBody body = assertError(response, HttpStatus.SERVICE_UNAVAILABLE, "AVAILABILITY_FETCH_ERROR");
        assertFalse(body.message().contains("secret"));
    }

    @Test
    void disabledSourceIsReportedByAdminApi() {
        registry.register("studio_ol", () -> new FixedStrategy(List.of()), ScraperMetadata.of("test", "1.0.0", false, null));
        ScraperAdminController admin = new ScraperAdminController(service(), registry);

        HttpResponse<?> disabled = admin.disable("studio_ol", new ScraperAdminController.DisableRequest("maintenance"));
        assertEquals(ScraperStatus.DISABLED, ((ScraperMetadata) disabled.body()).status());
        assertError(controller.availability("2", "2025-01-07", "10:00", "12:00", "1"), HttpStatus.SERVICE_UNAVAILABLE, "SOURCE_UNAVAILABLE");

        HttpResponse<?> enabled = admin.enable("studio_ol");
        assertEquals(ScraperStatus.ACTIVE, ((ScraperMetadata) enabled.body()).status());
        assertEquals(HttpStatus.NOT_FOUND, admin.enable("nope").getStatus());
        assertEquals(Set.of("studio_ol"), admin.list().keySet());
    }

    private static AvailabilityResponses.ErrorBody assertError(HttpResponse<?> response, HttpStatus status, String code) {
        assertEquals(status, response.getStatus());
        AvailabilityResponses.ErrorBody body = assertInstanceOf(AvailabilityResponses.ErrorBody.class, response.body());
        assertEquals("error", body.status());
        assertEquals(code, body.code());
        return body;
    }

    private AvailabilityService service() {
        StudioProperties ol = new StudioProperties("2");
        ol.setName("Bass On Top");
        ol.setScraperType("studio_ol");
        ol.setShopId("673");
        AvailabilityProperties props = new AvailabilityProperties();
        props.setDeadlineMs(10_000);
        return new AvailabilityService(registry, new AvailabilityMatcher(), new ConfiguredStudioCatalog(List.of(ol)),
                props, executor);
    }

    static final class FixedStrategy implements ScraperStrategy {

        private final List<TimeSlot> slots;

        FixedStrategy(List<TimeSlot> slots) {
            this.slots = new ArrayList<>(slots);
        }

        @Override
        public boolean establishConnection(String shopId) {
            return true;
        }

        @Override
        public List<RoomAvailability> fetchAvailableTimes(LocalDate date) {
            return List.of(RoomAvailability.of("A", date, slots, Set.of(0, 30), true));
        }
    }
}
