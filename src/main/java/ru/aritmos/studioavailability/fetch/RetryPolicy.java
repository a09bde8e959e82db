package ru.aritmos.studioavailability.fetch;

import java.time.Duration;

/**
 * Политика повторов с экспоненциальной задержкой.
 * <p>
 * Пауза после неудачной попытки {@code n}: {@code multiplier * 2^(n-1)}, ограниченная снизу {@code minWait}
 * и сверху {@code maxWait}. Последовательность пауз не убывает.
 */
public record RetryPolicy(int maxAttempts, Duration multiplier, Duration minWait, Duration maxWait) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        multiplier = multiplier == null || multiplier.isNegative() ? Duration.ZERO : multiplier;
        minWait = minWait == null || minWait.isNegative() ? Duration.ZERO : minWait;
        maxWait = maxWait == null || maxWait.compareTo(minWait) < 0 ? minWait : maxWait;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(3), Duration.ofSeconds(15));
    }

    /**
     * @param attempt номер неудачной попытки (с 1)
     * @return пауза перед следующей попыткой
     */
    public Duration delayAfter(int attempt) {
        long base = multiplier.toMillis();
        // Экспоненциальный рост: multiplier * 2^(attempt-1), сдвиг ограничен, чтобы не переполнить long
        long delay = base * (1L << Math.min(20, Math.max(0, attempt - 1)));
        delay = Math.max(delay, minWait.toMillis());
        delay = Math.min(delay, maxWait.toMillis());
        return Duration.ofMillis(delay);
    }
}
