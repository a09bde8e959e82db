package ru.aritmos.studioavailability.scraper;

import java.util.function.Supplier;

/**
 * Строка таблицы регистрации: источник, фабрика коннектора и его метаданные.
 */
public record ScraperRegistration(String sourceId, Supplier<? extends ScraperStrategy> factory, ScraperMetadata metadata) {
}
