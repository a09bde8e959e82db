package ru.aritmos.studioavailability.service;

import java.util.List;
import java.util.Optional;

/**
 * Справочник студий: идентификатор студии → источник и магазин.
 */
public interface StudioCatalog {

    Optional<StudioConfig> find(String studioId);

    List<StudioConfig> all();
}
