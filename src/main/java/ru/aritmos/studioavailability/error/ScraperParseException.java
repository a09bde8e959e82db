package ru.aritmos.studioavailability.error;

/**
 * Ответ источника имеет неожиданную структуру.
 */
public class ScraperParseException extends ScraperException {

    public ScraperParseException(String message) {
        super(message);
    }

    public ScraperParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
