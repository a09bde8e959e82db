package ru.aritmos.studioavailability.service;

import io.micronaut.context.annotation.EachProperty;
import io.micronaut.context.annotation.Parameter;
import io.micronaut.core.annotation.Introspected;

/**
 * Настройки одной студии ({@code studioavailability.studios.<id>.*}).
 */
@Introspected
@EachProperty("studioavailability.studios")
public class StudioProperties {

    private final String id;
    private String name;
    private String scraperType;
    private String shopId;

    public StudioProperties(@Parameter String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getScraperType() {
        return scraperType;
    }

    public void setScraperType(String scraperType) {
        this.scraperType = scraperType;
    }

    public String getShopId() {
        return shopId;
    }

    public void setShopId(String shopId) {
        this.shopId = shopId;
    }

    public StudioConfig toConfig() {
        String shop = shopId == null || shopId.isBlank() ? null : shopId.trim();
        return new StudioConfig(id, name == null || name.isBlank() ? id : name, scraperType, shop);
    }
}
