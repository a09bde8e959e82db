package ru.aritmos.studioavailability.scraper;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Introspected;

import java.util.ArrayList;
import java.util.List;

/**
 * Настройки реестра коннекторов ({@code studioavailability.scrapers.*}).
 */
@Introspected
@ConfigurationProperties("studioavailability.scrapers")
public class ScraperProperties {

    /**
     * Источники, которые после регистрации сразу переводятся в DISABLED.
     */
    private List<String> disabled = new ArrayList<>();

    public List<String> getDisabled() {
        return disabled;
    }

    public void setDisabled(List<String> disabled) {
        this.disabled = disabled == null ? new ArrayList<>() : disabled;
    }
}
