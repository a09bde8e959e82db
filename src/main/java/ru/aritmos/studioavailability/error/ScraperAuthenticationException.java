package ru.aritmos.studioavailability.error;

/**
 * Источник отклонил сессию или учётные данные (HTTP 401/403, просроченный токен).
 */
public class ScraperAuthenticationException extends ScraperException {

    public ScraperAuthenticationException(String message) {
        super(message);
    }

    public ScraperAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
