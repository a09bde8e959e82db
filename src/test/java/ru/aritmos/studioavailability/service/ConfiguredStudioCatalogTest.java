package ru.aritmos.studioavailability.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ConfiguredStudioCatalogTest {

    @Test
    void studiosWithoutScraperTypeAreSkipped() {
        StudioProperties pad = studio("1", "PADstudio", "pad_studio", null);
        StudioProperties broken = studio("5", "Broken", " ", "1");
        StudioProperties ol = studio("3", null, "studio_ol", " 546 ");

        ConfiguredStudioCatalog catalog = new ConfiguredStudioCatalog(List.of(ol, broken, pad));

        assertEquals(List.of("1", "3"), catalog.all().stream().map(StudioConfig::id).toList());
        assertEquals(Optional.empty(), catalog.find("5"));
        assertNull(catalog.find("1").orElseThrow().shopId());
        assertEquals("546", catalog.find(" 3 ").orElseThrow().shopId());
        assertEquals("3", catalog.find("3").orElseThrow().name());
        assertEquals(Optional.empty(), catalog.find(null));
    }

    private static StudioProperties studio(String id, String name, String type, String shop) {
        StudioProperties p = new StudioProperties(id);
        p.setName(name);
        p.setScraperType(type);
        p.setShopId(shop);
        return p;
    }
}
