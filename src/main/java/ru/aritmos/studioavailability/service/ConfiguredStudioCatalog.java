package ru.aritmos.studioavailability.service;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Справочник студий из конфигурации {@code studioavailability.studios}.
 * <p>
 * Записи без {@code scraper-type} пропускаются с предупреждением.
 */
@Singleton
public class ConfiguredStudioCatalog implements StudioCatalog {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredStudioCatalog.class);

    private final Map<String, StudioConfig> studios;

    public ConfiguredStudioCatalog(List<StudioProperties> properties) {
        List<StudioProperties> sorted = new ArrayList<>(properties == null ? List.of() : properties);
        sorted.sort(Comparator.comparing(StudioProperties::getId));

        Map<String, StudioConfig> m = new LinkedHashMap<>();
        for (StudioProperties p : sorted) {
            if (p.getScraperType() == null || p.getScraperType().isBlank()) {
                log.warn("Студия {} пропущена: не задан scraper-type", p.getId());
                continue;
            }
            m.put(p.getId(), p.toConfig());
        }
        this.studios = Collections.unmodifiableMap(m);
        log.info("Справочник студий загружен: {}", studios.keySet());
    }

    @Override
    public Optional<StudioConfig> find(String studioId) {
        return studioId == null ? Optional.empty() : Optional.ofNullable(studios.get(studioId.trim()));
    }

    @Override
    public List<StudioConfig> all() {
        return List.copyOf(studios.values());
    }
}
