package ru.aritmos.studioavailability.scraper;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.error.NotRegisteredException;
import ru.aritmos.studioavailability.error.RegistrationException;
import ru.aritmos.studioavailability.error.ScraperValidationException;
import ru.aritmos.studioavailability.error.UnavailableException;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Реестр коннекторов по идентификатору источника.
 * <p>
 * Хранит для каждого источника один проверенный экземпляр {@link ScraperStrategy} и его {@link ScraperMetadata}.
 * <p>
 * Важно:
 * <ul>
 *   <li>запись источника неизменяема и заменяется атомарно, поэтому {@link #lookup(String)} параллельно
 *       со сменой статуса всегда видит целостную запись;</li>
 *   <li>ошибка регистрации одного источника переводит его в {@link ScraperStatus#ERROR} и не мешает
 *       регистрации остальных;</li>
 *   <li>реестр не управляет параллелизмом вызовов самих коннекторов, это делает сервис доступности.</li>
 * </ul>
 */
@Singleton
public class ScraperRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScraperRegistry.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Зарегистрировать источник.
     * <p>
     * Фабрика вызывается один раз; полученный экземпляр проверяется и сохраняется со статусом ACTIVE.
     *
     * @param sourceId идентификатор источника
     * @param factory фабрика коннектора
     * @param metadata метаданные источника
     * @return зарегистрированный экземпляр
     * @throws RegistrationException если фабрика или проверка завершились ошибкой (источник сохраняется в ERROR)
     */
    public ScraperStrategy register(String sourceId, Supplier<? extends ScraperStrategy> factory, ScraperMetadata metadata) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("Не задан идентификатор источника");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("Не заданы метаданные источника " + sourceId);
        }

        try {
            if (factory == null) {
                throw new ScraperValidationException("Не задана фабрика коннектора");
            }
            ScraperStrategy instance = factory.get();
            validate(instance, metadata);

            entries.put(sourceId, new Entry(instance, instance.getClass().getSimpleName(), metadata.withStatus(ScraperStatus.ACTIVE, null)));
            log.info("Источник {} зарегистрирован: {} v{}", sourceId, instance.getClass().getSimpleName(), metadata.version());
            return instance;
        } catch (RuntimeException e) {
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            entries.put(sourceId, new Entry(null, null, metadata.withStatus(ScraperStatus.ERROR, msg)));
            log.error("Не удалось зарегистрировать источник {}: {}", sourceId, msg);
            throw new RegistrationException(sourceId, e);
        }
    }

    /**
     * Снять источник с регистрации.
     *
     * @return true, если источник был зарегистрирован
     */
    public boolean unregister(String sourceId) {
        boolean removed = sourceId != null && entries.remove(sourceId) != null;
        if (removed) {
            log.info("Источник {} снят с регистрации", sourceId);
        }
        return removed;
    }

    /**
     * Получить коннектор источника.
     *
     * @throws NotRegisteredException источник не зарегистрирован
     * @throws UnavailableException статус источника не ACTIVE
     */
    public ScraperStrategy lookup(String sourceId) {
        Entry e = sourceId == null ? null : entries.get(sourceId);
        if (e == null) {
            throw new NotRegisteredException(sourceId);
        }
        ScraperMetadata m = e.metadata();
        if (m.status() != ScraperStatus.ACTIVE || e.strategy() == null) {
            throw new UnavailableException(sourceId, m.status(), m.errorMessage());
        }
        return e.strategy();
    }

    /**
     * Отключить источник (действие оператора). Повторный вызов ничего не меняет.
     * Источник в статусе ERROR остаётся в ERROR.
     */
    public ScraperMetadata disable(String sourceId, String reason) {
        Entry updated = entries.computeIfPresent(sourceId == null ? "" : sourceId, (id, e) -> {
            if (e.metadata().status() != ScraperStatus.ACTIVE) {
                return e;
            }
            return e.withMetadata(e.metadata().withStatus(ScraperStatus.DISABLED, reason));
        });
        if (updated == null) {
            throw new NotRegisteredException(sourceId);
        }
        if (updated.metadata().status() == ScraperStatus.DISABLED) {
            log.info("Источник {} отключён: {}", sourceId, updated.metadata().errorMessage());
        } else {
            log.warn("Источник {} в статусе {} не может быть отключён", sourceId, updated.metadata().status());
        }
        return updated.metadata();
    }

    /**
     * Включить отключённый источник. Повторный вызов ничего не меняет.
     * <p>
     * Источник в статусе ERROR не включается: у него нет проверенного экземпляра, нужна повторная регистрация.
     */
    public ScraperMetadata enable(String sourceId) {
        Entry updated = entries.computeIfPresent(sourceId == null ? "" : sourceId, (id, e) -> {
            if (e.metadata().status() != ScraperStatus.DISABLED) {
                return e;
            }
            return e.withMetadata(e.metadata().withStatus(ScraperStatus.ACTIVE, null));
        });
        if (updated == null) {
            throw new NotRegisteredException(sourceId);
        }
        if (updated.metadata().status() == ScraperStatus.ERROR) {
            log.warn("Источник {} в статусе ERROR не может быть включён без повторной регистрации", sourceId);
        } else {
            log.info("Источник {} включён", sourceId);
        }
        return updated.metadata();
    }

    public Optional<ScraperMetadata> metadata(String sourceId) {
        Entry e = sourceId == null ? null : entries.get(sourceId);
        return e == null ? Optional.empty() : Optional.of(e.metadata());
    }

    /**
     * @return снимок зарегистрированных источников (для диагностики), упорядоченный по идентификатору
     */
    public Map<String, ScraperInfo> list() {
        Map<String, ScraperInfo> out = new TreeMap<>();
        entries.forEach((id, e) -> out.put(id, new ScraperInfo(e.className(), e.metadata())));
        return Collections.unmodifiableMap(out);
    }

    private static void validate(ScraperStrategy instance, ScraperMetadata metadata) {
        if (instance == null) {
            throw new ScraperValidationException("Фабрика вернула null вместо коннектора");
        }
        if (isBlank(metadata.description()) || isBlank(metadata.version())) {
            throw new ScraperValidationException("В метаданных обязательны description и version");
        }
        if (!isBlank(metadata.baseUrl())) {
            URI uri;
            try {
                uri = URI.create(metadata.baseUrl());
            } catch (IllegalArgumentException e) {
                throw new ScraperValidationException("Некорректный baseUrl: " + metadata.baseUrl(), e);
            }
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw new ScraperValidationException("baseUrl должен быть абсолютным http(s) URL: " + metadata.baseUrl());
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Диагностическое представление источника.
     *
     * @param className простое имя класса коннектора или null, если экземпляр не создан
     * @param metadata метаданные
     */
    @Serdeable
    public record ScraperInfo(String className, ScraperMetadata metadata) {
    }

    private record Entry(ScraperStrategy strategy, String className, ScraperMetadata metadata) {

        Entry withMetadata(ScraperMetadata m) {
            return new Entry(strategy, className, m);
        }
    }
}
