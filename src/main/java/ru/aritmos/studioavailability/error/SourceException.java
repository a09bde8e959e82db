package ru.aritmos.studioavailability.error;

/**
 * Сетевая/транспортная ошибка обращения к источнику.
 * <p>
 * {@code retryable=true} означает транзиентную ошибку (обрыв соединения, таймаут, 5xx),
 * которую клиент загрузки повторяет сам; наружу такая ошибка выходит только после исчерпания попыток.
 */
public class SourceException extends ScraperException {

    private final boolean retryable;
    private final int httpStatus;
    private final int attempts;

    public SourceException(String message, boolean retryable, int httpStatus, Throwable cause) {
        this(message, retryable, httpStatus, 1, cause);
    }

    public SourceException(String message, boolean retryable, int httpStatus, int attempts, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.httpStatus = httpStatus;
        this.attempts = attempts;
    }

    public static SourceException exhausted(String target, int attempts, SourceException last) {
        return new SourceException("Исчерпаны попытки (retries exhausted) для " + target + ": attempts=" + attempts,
                false,
                last == null ? -1 : last.httpStatus(),
                attempts,
                last);
    }

    public boolean retryable() {
        return retryable;
    }

    /**
     * @return HTTP-статус ответа или -1, если ответа не было
     */
    public int httpStatus() {
        return httpStatus;
    }

    public int attempts() {
        return attempts;
    }
}
