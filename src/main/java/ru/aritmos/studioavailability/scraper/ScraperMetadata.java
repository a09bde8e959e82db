package ru.aritmos.studioavailability.scraper;

import io.micronaut.serde.annotation.Serdeable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Метаданные источника.
 * <p>
 * Значение неизменяемо; смена статуса выполняется только реестром через {@link #withStatus(ScraperStatus, String)}.
 *
 * @param description описание
 * @param version версия коннектора
 * @param requiresAuth требует ли источник сессии/авторизации
 * @param baseUrl базовый URL источника или null
 * @param status текущий статус
 * @param errorMessage причина отключения/ошибки или null
 * @param additionalInfo диагностические атрибуты (сетка старта коннектора и т.п.)
 */
@Serdeable
public record ScraperMetadata(String description,
                              String version,
                              boolean requiresAuth,
                              String baseUrl,
                              ScraperStatus status,
                              String errorMessage,
                              Map<String, String> additionalInfo) {

    public ScraperMetadata {
        status = status == null ? ScraperStatus.ACTIVE : status;
        additionalInfo = additionalInfo == null ? Map.of() : Map.copyOf(additionalInfo);
    }

    public static ScraperMetadata of(String description, String version, boolean requiresAuth, String baseUrl) {
        return new ScraperMetadata(description, version, requiresAuth, baseUrl, ScraperStatus.ACTIVE, null, Map.of());
    }

    /**
     * Копия с дополнительными атрибутами; совпадающие ключи перезаписываются.
     */
    public ScraperMetadata withInfo(Map<String, String> info) {
        Map<String, String> merged = new LinkedHashMap<>(additionalInfo);
        merged.putAll(info);
        return new ScraperMetadata(description, version, requiresAuth, baseUrl, status, errorMessage, merged);
    }

    public ScraperMetadata withStatus(ScraperStatus newStatus, String message) {
        return new ScraperMetadata(description, version, requiresAuth, baseUrl, newStatus, message, additionalInfo);
    }
}
