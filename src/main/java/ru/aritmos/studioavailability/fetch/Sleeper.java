package ru.aritmos.studioavailability.fetch;

import java.time.Duration;

/**
 * Ожидание между попытками. Отдельный тип нужен, чтобы тесты могли фиксировать паузы, не засыпая.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
