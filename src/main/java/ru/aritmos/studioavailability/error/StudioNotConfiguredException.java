package ru.aritmos.studioavailability.error;

/**
 * Студия с указанным идентификатором отсутствует в справочнике.
 */
public class StudioNotConfiguredException extends ScraperException {

    private final String studioId;

    public StudioNotConfiguredException(String studioId) {
        super("Студия " + studioId + " не настроена");
        this.studioId = studioId;
    }

    public String studioId() {
        return studioId;
    }
}
