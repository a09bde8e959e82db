package ru.aritmos.studioavailability.scraper;

import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.event.ApplicationStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.studioavailability.error.RegistrationException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Регистрация источников при старте приложения.
 * <p>
 * Важно:
 * <ul>
 *   <li>регистрация выполняется ровно один раз, повторное событие старта игнорируется;</li>
 *   <li>ошибка одного источника логируется, источник остаётся в статусе ERROR, остальные регистрируются;</li>
 *   <li>источники из {@code studioavailability.scrapers.disabled} переводятся в DISABLED.</li>
 * </ul>
 */
@Singleton
public class ScraperRegistryInitializer implements ApplicationEventListener<ApplicationStartupEvent> {

    private static final Logger log = LoggerFactory.getLogger(ScraperRegistryInitializer.class);

    private final ScraperRegistry registry;
    private final ScraperCatalog catalog;
    private final ScraperProperties properties;
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    public ScraperRegistryInitializer(ScraperRegistry registry, ScraperCatalog catalog, ScraperProperties properties) {
        this.registry = registry;
        this.catalog = catalog;
        this.properties = properties;
    }

    @Override
    public void onApplicationEvent(ApplicationStartupEvent event) {
        initialize();
    }

    /**
     * @return число источников в статусе ACTIVE после регистрации, или -1 если регистрация уже выполнялась
     */
    public int initialize() {
        if (!initialized.compareAndSet(false, true)) {
            log.debug("Источники уже зарегистрированы, повторная регистрация пропущена");
            return -1;
        }

        int active = 0;
        for (ScraperRegistration r : catalog.registrations()) {
            try {
                registry.register(r.sourceId(), r.factory(), r.metadata());
                if (properties.getDisabled().contains(r.sourceId())) {
                    registry.disable(r.sourceId(), "отключён настройкой studioavailability.scrapers.disabled");
                } else {
                    active++;
                }
            } catch (RegistrationException e) {
                log.error("Источник {} не зарегистрирован и будет недоступен: {}", r.sourceId(),
                        e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            }
        }
        log.info("Регистрация источников завершена: активных={}, всего={}", active, registry.list().size());
        return active;
    }
}
