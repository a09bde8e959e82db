package ru.aritmos.studioavailability.api;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.studioavailability.error.NotRegisteredException;
import ru.aritmos.studioavailability.scraper.ScraperMetadata;
import ru.aritmos.studioavailability.scraper.ScraperRegistry;
import ru.aritmos.studioavailability.service.AvailabilityService;

import java.util.Map;

/**
 * Admin API: диагностика и ручное включение/отключение источников.
 */
@Controller("/admin/scrapers")
@Tag(name = "Studio Availability: Admin API (Scrapers)", description = "Статусы коннекторов")
public class ScraperAdminController {

    private final AvailabilityService service;
    private final ScraperRegistry registry;

    public ScraperAdminController(AvailabilityService service, ScraperRegistry registry) {
        this.service = service;
        this.registry = registry;
    }

    @Get
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Список зарегистрированных источников")
    public Map<String, ScraperRegistry.ScraperInfo> list() {
        return service.listSources();
    }

    @Post(uri = "/{sourceId}/disable")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Отключить источник")
    @ApiResponse(responseCode = "404", description = "Источник не зарегистрирован")
    public HttpResponse<?> disable(@PathVariable("sourceId") String sourceId, @Nullable @Body DisableRequest request) {
        try {
            String reason = request == null || request.reason() == null || request.reason().isBlank()
                    ? "отключён оператором"
                    : request.reason();
            ScraperMetadata m = registry.disable(sourceId, reason);
            return HttpResponse.ok(m);
        } catch (NotRegisteredException ex) {
            return HttpResponse.notFound(AvailabilityResponses.error("SCRAPER_NOT_REGISTERED", ex.getMessage()));
        }
    }

    @Post(uri = "/{sourceId}/enable")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Включить отключённый источник")
    @ApiResponse(responseCode = "404", description = "Источник не зарегистрирован")
    public HttpResponse<?> enable(@PathVariable("sourceId") String sourceId) {
        try {
            return HttpResponse.ok(registry.enable(sourceId));
        } catch (NotRegisteredException ex) {
            return HttpResponse.notFound(AvailabilityResponses.error("SCRAPER_NOT_REGISTERED", ex.getMessage()));
        }
    }

    @Serdeable
    @Schema(name = "ScraperDisableRequest", description = "Причина отключения источника")
    public record DisableRequest(@Schema(description = "Причина") String reason) {
    }
}
