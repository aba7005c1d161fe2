package com.appreview.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAppCatalogTest {

    @Test
    @DisplayName("Registered apps start without ratings")
    void registeredAppsStartEmpty() {
        InMemoryAppCatalog catalog = new InMemoryAppCatalog();
        catalog.register("app-1");

        assertTrue(catalog.exists("app-1"));
        assertEquals(AppRating.empty("app-1"), catalog.getRating("app-1").orElseThrow());
    }

    @Test
    @DisplayName("Ratings of unknown apps are ignored")
    void unknownAppIgnored() {
        InMemoryAppCatalog catalog = new InMemoryAppCatalog();

        catalog.updateRating("ghost", 4.5, 2);

        assertFalse(catalog.exists("ghost"));
        assertTrue(catalog.getRating("ghost").isEmpty());
    }

    @Test
    @DisplayName("Updates replace the aggregate")
    void updateReplaces() {
        InMemoryAppCatalog catalog = new InMemoryAppCatalog();
        catalog.register("app-1");

        catalog.updateRating("app-1", 3.67, 3);

        assertEquals(new AppRating("app-1", 3.67, 3), catalog.getRating("app-1").orElseThrow());
    }
}
