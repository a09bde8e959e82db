package ru.aritmos.studioavailability.fetch;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Introspected;

import java.time.Duration;

/**
 * Настройки клиента загрузки ({@code studioavailability.fetch.*}).
 * <p>
 * Значения по умолчанию соответствуют эксплуатационным наблюдениям за источниками:
 * до 5 попыток, пауза 3–15 секунд, соединение 10 секунд, чтение 30 секунд.
 */
@Introspected
@ConfigurationProperties("studioavailability.fetch")
public class FetchProperties {

    private int maxAttempts = 5;
    private long multiplierMs = 1000;
    private long minWaitMs = 3000;
    private long maxWaitMs = 15000;
    private long connectTimeoutMs = 10000;
    private long readTimeoutMs = 30000;
    private String userAgent = "Mozilla/5.0 (compatible; studio-availability/1.0)";

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getMultiplierMs() {
        return multiplierMs;
    }

    public void setMultiplierMs(long multiplierMs) {
        this.multiplierMs = multiplierMs;
    }

    public long getMinWaitMs() {
        return minWaitMs;
    }

    public void setMinWaitMs(long minWaitMs) {
        this.minWaitMs = minWaitMs;
    }

    public long getMaxWaitMs() {
        return maxWaitMs;
    }

    public void setMaxWaitMs(long maxWaitMs) {
        this.maxWaitMs = maxWaitMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(long readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(maxAttempts,
                Duration.ofMillis(multiplierMs),
                Duration.ofMillis(minWaitMs),
                Duration.ofMillis(maxWaitMs));
    }

    public Duration readTimeout() {
        return Duration.ofMillis(Math.max(100, readTimeoutMs));
    }
}
