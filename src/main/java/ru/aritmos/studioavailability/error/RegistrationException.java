package ru.aritmos.studioavailability.error;

/**
 * Ошибка регистрации коннектора.
 * <p>
 * Реестр сохраняет источник в статусе ERROR и пробрасывает это исключение; регистрация остальных
 * источников продолжается.
 */
public class RegistrationException extends ScraperException {

    private final String sourceId;

    public RegistrationException(String sourceId, Throwable cause) {
        super("Не удалось зарегистрировать источник " + sourceId, cause);
        this.sourceId = sourceId;
    }

    public String sourceId() {
        return sourceId;
    }
}
