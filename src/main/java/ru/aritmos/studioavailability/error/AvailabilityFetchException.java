package ru.aritmos.studioavailability.error;

/**
 * Ошибка получения доступности, видимая вызывающему слою (API).
 * <p>
 * Оборачивает исходную причину; {@link #code()} используется для структурированного ответа
 * {@code {status:"error", code, message}}.
 */
public class AvailabilityFetchException extends ScraperException {

    public static final String FETCH_ERROR = "AVAILABILITY_FETCH_ERROR";
    public static final String SOURCE_UNAVAILABLE = "SOURCE_UNAVAILABLE";
    public static final String DEADLINE_EXCEEDED = "DEADLINE_EXCEEDED";
    public static final String NOT_REGISTERED = "SCRAPER_NOT_REGISTERED";

    private final String code;
    private final String sourceId;

    public AvailabilityFetchException(String code, String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.code = code == null ? FETCH_ERROR : code;
        this.sourceId = sourceId;
    }

    public String code() {
        return code;
    }

    public String sourceId() {
        return sourceId;
    }
}
