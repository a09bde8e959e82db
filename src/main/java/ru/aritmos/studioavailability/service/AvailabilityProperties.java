package ru.aritmos.studioavailability.service;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Introspected;

import java.time.Duration;

/**
 * Настройки сервиса доступности ({@code studioavailability.availability.*}).
 */
@Introspected
@ConfigurationProperties("studioavailability.availability")
public class AvailabilityProperties {

    /**
     * Общий дедлайн одного получения доступности (все попытки и паузы включительно).
     */
    private long deadlineMs = 90000;

    public long getDeadlineMs() {
        return deadlineMs;
    }

    public void setDeadlineMs(long deadlineMs) {
        this.deadlineMs = deadlineMs;
    }

    public Duration deadline() {
        return Duration.ofMillis(Math.max(1, deadlineMs));
    }
}
