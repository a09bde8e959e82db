package ru.aritmos.studioavailability.service;

import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.core.SensitiveDataSanitizer;
import ru.aritmos.studioavailability.error.AvailabilityFetchException;
import ru.aritmos.studioavailability.error.NotRegisteredException;
import ru.aritmos.studioavailability.error.StudioNotConfiguredException;
import ru.aritmos.studioavailability.error.UnavailableException;
import ru.aritmos.studioavailability.matching.AvailabilityMatcher;
import ru.aritmos.studioavailability.model.DesiredRange;
import ru.aritmos.studioavailability.model.RoomAvailability;
import ru.aritmos.studioavailability.scraper.ScraperRegistry;
import ru.aritmos.studioavailability.scraper.ScraperStrategy;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.WeakHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Единая точка получения доступности студий.
 * <p>
 * Последовательность: поиск коннектора в реестре → установка сессии → получение расписания →
 * (опционально) подбор окон.
 * <p>
 * Важно:
 * <ul>
 *   <li>загрузка выполняется на IO-пуле и ограничена общим дедлайном; по истечении задача прерывается;</li>
 *   <li>один экземпляр коннектора обслуживает не более одного вызова одновременно,
 *       разные источники работают параллельно; ожидание очереди к коннектору прерывается вместе с задачей;</li>
 *   <li>любая ошибка во время вызова оборачивается в {@link AvailabilityFetchException} с исходной причиной;
 *       ошибки валидации запроса пробрасываются как есть.</li>
 * </ul>
 */
@Singleton
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final ScraperRegistry registry;
    private final AvailabilityMatcher matcher;
    private final StudioCatalog studios;
    private final ExecutorService executor;
    private final Duration deadline;
    private final Map<ScraperStrategy, ReentrantLock> locks = Collections.synchronizedMap(new WeakHashMap<>());

    public AvailabilityService(ScraperRegistry registry,
                               AvailabilityMatcher matcher,
                               StudioCatalog studios,
                               AvailabilityProperties properties,
                               @Named(TaskExecutors.IO) ExecutorService executor) {
        this.registry = registry;
        this.matcher = matcher;
        this.studios = studios;
        this.executor = executor;
        this.deadline = properties.deadline();
    }

    /**
     * Получить «сырую» доступность комнат источника на дату.
     *
     * @param sourceId идентификатор источника
     * @param shopId идентификатор магазина или null
     * @param date дата
     * @throws AvailabilityFetchException любая ошибка реестра, сети, сессии или разбора
     */
    public List<RoomAvailability> getAvailability(String sourceId, String shopId, LocalDate date) {
        ScraperStrategy strategy;
        try {
            strategy = registry.lookup(sourceId);
        } catch (NotRegisteredException e) {
            throw new AvailabilityFetchException(AvailabilityFetchException.NOT_REGISTERED, sourceId, e.getMessage(), e);
        } catch (UnavailableException e) {
            throw new AvailabilityFetchException(AvailabilityFetchException.SOURCE_UNAVAILABLE, sourceId, e.getMessage(), e);
        }

        long startedAt = System.nanoTime();
        Future<List<RoomAvailability>> task = executor.submit(() -> fetch(strategy, shopId, date));
        try {
            List<RoomAvailability> rooms = task.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Доступность {} (магазин {}) на {} получена: комнат={}, elapsedMs={}",
                    sourceId, shopId, date, rooms.size(), elapsedMs(startedAt));
            return rooms;
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Доступность {} на {}: превышен дедлайн {} мс", sourceId, date, deadline.toMillis());
            throw new AvailabilityFetchException(AvailabilityFetchException.DEADLINE_EXCEEDED, sourceId,
                    "Источник " + sourceId + " не ответил за " + deadline.toMillis() + " мс", e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new AvailabilityFetchException(AvailabilityFetchException.FETCH_ERROR, sourceId,
                    "Получение доступности " + sourceId + " прервано", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            String msg = SensitiveDataSanitizer.sanitizeText(
                    cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
            log.warn("Доступность {} на {} не получена: {}", sourceId, date, msg);
            throw new AvailabilityFetchException(AvailabilityFetchException.FETCH_ERROR, sourceId,
                    "Не удалось получить доступность " + sourceId + ": " + msg, cause);
        }
    }

    /**
     * Получить окна, подходящие под диапазон и длительность.
     *
     * @throws ru.aritmos.studioavailability.error.ScraperValidationException некорректная длительность или диапазон
     * @throws AvailabilityFetchException ошибка получения доступности
     */
    public List<RoomAvailability> getMatchingAvailability(String sourceId,
                                                          String shopId,
                                                          LocalDate date,
                                                          DesiredRange range,
                                                          double durationHours) {
        matcher.validateQuery(range, durationHours);

        List<RoomAvailability> rooms = getAvailability(sourceId, shopId, date);
        return matcher.findAvailable(rooms, range, durationHours);
    }

    /**
     * Подбор окон для студии из справочника.
     *
     * @throws StudioNotConfiguredException студия не настроена
     */
    public StudioAvailability getStudioAvailability(String studioId, LocalDate date, DesiredRange range, double durationHours) {
        StudioConfig studio = studios.find(studioId).orElseThrow(() -> new StudioNotConfiguredException(studioId));
        List<RoomAvailability> rooms = getMatchingAvailability(studio.scraperType(), studio.shopId(), date, range, durationHours);
        return new StudioAvailability(studio, date, rooms);
    }

    public Map<String, ScraperRegistry.ScraperInfo> listSources() {
        return registry.list();
    }

    private List<RoomAvailability> fetch(ScraperStrategy strategy, String shopId, LocalDate date)
            throws InterruptedException {
        ReentrantLock lock = locks.computeIfAbsent(strategy, s -> new ReentrantLock());
        lock.lockInterruptibly();
        try {
            strategy.establishConnection(shopId);
            return strategy.fetchAvailableTimes(date);
        } finally {
            lock.unlock();
        }
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }

    /**
     * Результат подбора для студии.
     */
    public record StudioAvailability(StudioConfig studio, LocalDate date, List<RoomAvailability> rooms) {
    }
}
