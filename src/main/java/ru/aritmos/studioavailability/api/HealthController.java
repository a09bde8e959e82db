package ru.aritmos.studioavailability.api;

import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Produces;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

/**
 * Проверка живости для балансировщика.
 */
@Controller("/health")
@Tag(name = "Health")
public class HealthController {

    @Get
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "Сервис запущен")
    public String health() {
        return "ok";
    }
}
