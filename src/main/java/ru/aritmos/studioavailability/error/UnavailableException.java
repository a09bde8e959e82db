package ru.aritmos.studioavailability.error;

import ru.aritmos.studioavailability.scraper.ScraperStatus;

/**
 * Источник зарегистрирован, но сейчас не может обслуживать запросы
 * (статус {@link ScraperStatus#DISABLED} или {@link ScraperStatus#ERROR}).
 */
public class UnavailableException extends ScraperException {

    private final String sourceId;
    private final ScraperStatus status;

    public UnavailableException(String sourceId, ScraperStatus status, String reason) {
        super("Источник " + sourceId + " недоступен, статус=" + status
                + (reason == null || reason.isBlank() ? "" : ": " + reason));
        this.sourceId = sourceId;
        this.status = status;
    }

    public String sourceId() {
        return sourceId;
    }

    public ScraperStatus status() {
        return status;
    }
}
