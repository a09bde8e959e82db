package ru.aritmos.studioavailability.api;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.core.SensitiveDataSanitizer;
import ru.aritmos.studioavailability.error.AvailabilityFetchException;
import ru.aritmos.studioavailability.error.ScraperValidationException;
import ru.aritmos.studioavailability.error.StudioNotConfiguredException;
import ru.aritmos.studioavailability.model.DesiredRange;
import ru.aritmos.studioavailability.service.AvailabilityService;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * API подбора окон бронирования.
 * <p>
 * Загрузка расписания блокирующая, поэтому обработчик выполняется на BLOCKING-пуле.
 */
@Controller("/api/studios")
@ExecuteOn(TaskExecutors.BLOCKING)
@Tag(name = "Studio Availability API", description = "Свободные окна репетиционных студий")
public class AvailabilityController {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityController.class);

    private final AvailabilityService service;

    public AvailabilityController(AvailabilityService service) {
        this.service = service;
    }

    @Get(uri = "/{studioId}/availability")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Подобрать окна бронирования студии на дату")
    @ApiResponse(responseCode = "200", description = "Окна найдены (список может быть пустым)",
            content = @Content(schema = @Schema(implementation = AvailabilityResponses.AvailabilityEnvelope.class)))
    @ApiResponse(responseCode = "400", description = "Некорректные параметры",
            content = @Content(schema = @Schema(implementation = AvailabilityResponses.ErrorBody.class)))
    @ApiResponse(responseCode = "404", description = "Студия или источник не настроены")
    @ApiResponse(responseCode = "503", description = "Источник недоступен")
    public HttpResponse<?> availability(
            @Parameter(description = "Идентификатор студии") @PathVariable("studioId") String studioId,
            @Parameter(description = "Дата, YYYY-MM-DD") @QueryValue("date") String date,
            @Parameter(description = "Начало диапазона, HH:MM") @QueryValue("start") String start,
            @Parameter(description = "Конец диапазона, HH:MM или 24:00") @QueryValue("end") String end,
            @Parameter(description = "Длительность в часах") @QueryValue("duration") String duration) {
        try {
            LocalDate day = LocalDate.parse(date);
            DesiredRange range = DesiredRange.parse(start, end);
            double hours = Double.parseDouble(duration);

            AvailabilityService.StudioAvailability result = service.getStudioAvailability(studioId, day, range, hours);
            return HttpResponse.ok(AvailabilityResponses.success(result));
        } catch (DateTimeParseException | NumberFormatException ex) {
            return HttpResponse.badRequest(AvailabilityResponses.error("VALIDATION_ERROR",
                    "Некорректный параметр запроса: " + ex.getMessage()));
        } catch (ScraperValidationException ex) {
            return HttpResponse.badRequest(AvailabilityResponses.error("VALIDATION_ERROR", ex.getMessage()));
        } catch (StudioNotConfiguredException ex) {
            return HttpResponse.notFound(AvailabilityResponses.error("STUDIO_NOT_CONFIGURED", ex.getMessage()));
        } catch (AvailabilityFetchException ex) {
            String message = SensitiveDataSanitizer.sanitizeText(ex.getMessage());
            if (AvailabilityFetchException.NOT_REGISTERED.equals(ex.code())) {
                return HttpResponse.notFound(AvailabilityResponses.error(ex.code(), message));
            }
            log.warn("Студия {}: доступность не получена, code={}, {}", studioId, ex.code(), message);
            return HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(AvailabilityResponses.error(ex.code(), message));
        }
    }
}
