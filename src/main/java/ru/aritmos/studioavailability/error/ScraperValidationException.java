package ru.aritmos.studioavailability.error;

/**
 * Данные нарушают инвариант модели: порядок времени, длительность, значение сетки минут старта.
 */
public class ScraperValidationException extends ScraperException {

    public ScraperValidationException(String message) {
        super(message);
    }

    public ScraperValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
