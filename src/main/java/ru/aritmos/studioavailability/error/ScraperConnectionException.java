package ru.aritmos.studioavailability.error;

/**
 * Не удалось установить сессию с источником (handshake, получение токена или cookie).
 */
public class ScraperConnectionException extends ScraperException {

    public ScraperConnectionException(String message) {
        super(message);
    }

    public ScraperConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
