package ru.aritmos.studioavailability.scraper;

/**
 * Состояние источника в реестре.
 */
public enum ScraperStatus {
    /** источник обслуживает запросы */
    ACTIVE,
    /** источник отключён оператором */
    DISABLED,
    /** регистрация/валидация источника завершилась ошибкой */
    ERROR
}
