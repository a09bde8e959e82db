package ru.aritmos.studioavailability.error;

/**
 * Источник с указанным идентификатором не зарегистрирован в реестре.
 */
public class NotRegisteredException extends ScraperException {

    private final String sourceId;

    public NotRegisteredException(String sourceId) {
        super("Источник не зарегистрирован: " + sourceId);
        this.sourceId = sourceId;
    }

    public String sourceId() {
        return sourceId;
    }
}
