package ru.aritmos.studioavailability.service;

/**
 * Студия и способ получения её расписания.
 *
 * @param id идентификатор студии во внешнем API
 * @param name отображаемое название
 * @param scraperType идентификатор источника в реестре коннекторов
 * @param shopId идентификатор магазина в источнике или null
 */
public record StudioConfig(String id, String name, String scraperType, String shopId) {
}
