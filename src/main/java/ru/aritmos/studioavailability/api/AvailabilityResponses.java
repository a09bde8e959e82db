package ru.aritmos.studioavailability.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import ru.aritmos.studioavailability.model.RoomAvailability;
import ru.aritmos.studioavailability.model.TimeOfDay;
import ru.aritmos.studioavailability.model.TimeSlot;
import ru.aritmos.studioavailability.service.AvailabilityService;

import java.util.ArrayList;
import java.util.List;

/**
 * Внешние DTO API доступности и их сборка из доменных значений.
 * <p>
 * Конец интервала в полночь выводится как {@code 24:00}.
 */
public final class AvailabilityResponses {

    public static final String TIMEZONE = "Asia/Tokyo";

    private AvailabilityResponses() {
    }

    public static AvailabilityEnvelope success(AvailabilityService.StudioAvailability result) {
        List<AvailableRange> ranges = new ArrayList<>();
        for (RoomAvailability room : result.rooms()) {
            List<Integer> minutes = List.copyOf(room.startMinutes());
            for (TimeSlot slot : room.slots()) {
                ranges.add(new AvailableRange(room.roomName(),
                        TimeOfDay.format(slot.start(), false),
                        TimeOfDay.format(slot.end(), true),
                        minutes));
            }
        }
        AvailabilityData data = new AvailabilityData(result.studio().id(), result.studio().name(),
                result.date().toString(), ranges, new Meta(TIMEZONE));
        return new AvailabilityEnvelope("success", data);
    }

    public static ErrorBody error(String code, String message) {
        return new ErrorBody("error", code, message);
    }

    @Serdeable
    @Schema(name = "AvailabilityResponse", description = "Успешный ответ подбора окон")
    public record AvailabilityEnvelope(
            @Schema(description = "Всегда success") String status,
            @Schema(description = "Результат") AvailabilityData data
    ) {
    }

    @Serdeable
    @Schema(name = "AvailabilityData", description = "Окна бронирования студии на дату")
    public record AvailabilityData(
            @JsonProperty("studio_id") @Schema(description = "Идентификатор студии") String studioId,
            @JsonProperty("studio_name") @Schema(description = "Название студии") String studioName,
            @Schema(description = "Дата, YYYY-MM-DD") String date,
            @JsonProperty("available_ranges") @Schema(description = "Подходящие окна по комнатам") List<AvailableRange> availableRanges,
            @Schema(description = "Служебные сведения") Meta meta
    ) {
    }

    @Serdeable
    @Schema(name = "AvailableRange", description = "Окно бронирования комнаты")
    public record AvailableRange(
            @JsonProperty("room_name") @Schema(description = "Название комнаты") String roomName,
            @Schema(description = "Начало, HH:MM") String start,
            @Schema(description = "Конец, HH:MM или 24:00") String end,
            @JsonProperty("start_minutes") @Schema(description = "Допустимые минуты старта внутри часа") List<Integer> startMinutes
    ) {
    }

    @Serdeable
    public record Meta(String timezone) {
    }

    @Serdeable
    @Schema(name = "ErrorResponse", description = "Структурированная ошибка")
    public record ErrorBody(
            @Schema(description = "Всегда error") String status,
            @Schema(description = "Код ошибки") String code,
            @Schema(description = "Описание") String message
    ) {
    }
}
