package com.catalog.reconciliation.config;

import com.catalog.reconciliation.core.model.Collection;
import com.catalog.reconciliation.core.model.LibrarySystem;
import com.catalog.reconciliation.core.model.OrderAttribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigLoaderTest {

    private final EngineConfigLoader loader = new EngineConfigLoader();

    @Test
    @DisplayName("Bundled configuration should carry bib id tags per library")
    void bibIdTags() {
        EngineConfig config = loader.loadDefault();
        assertEquals("945", config.bibIdTag(LibrarySystem.NYPL));
        assertEquals("907", config.bibIdTag(LibrarySystem.BPL));
    }

    @Test
    @DisplayName("Order mapping should keep tag and subfield order")
    void orderMappingOrder() {
        List<OrderFieldMapping> mappings = loader.loadDefault().orderFieldMappings();

        assertEquals(List.of("960", "961"), mappings.stream().map(OrderFieldMapping::tag).toList());
        OrderFieldMapping.SubfieldMapping first = mappings.get(0).subfields().get(0);
        assertEquals("c", first.code());
        assertEquals(OrderAttribute.ORDER_CODE_1, first.attribute());
        assertEquals(16, mappings.get(0).subfields().size());
        assertEquals(6, mappings.get(1).subfields().size());
    }

    @Test
    @DisplayName("Default locations should exist only where configured")
    void defaultLocations() {
        EngineConfig config = loader.loadDefault();
        assertEquals(Optional.of("zzzzz"), config.defaultLocation(LibrarySystem.NYPL, Collection.BRANCH));
        assertTrue(config.defaultLocation(LibrarySystem.BPL, Collection.NONE).isEmpty());
        assertTrue(config.defaultLocation(LibrarySystem.NYPL, Collection.NONE).isEmpty());
    }

    @Test
    @DisplayName("Vendor lists should be looked up per library")
    void vendorLists() {
        EngineConfig config = loader.loadDefault();
        assertTrue(config.isAttachOnlyVendor(LibrarySystem.BPL, "Midwest DVD"));
        assertFalse(config.isAttachOnlyVendor(LibrarySystem.NYPL, "Midwest DVD"));
        assertTrue(config.requiresCallNumberRebuild("BT SERIES"));
        assertFalse(config.requiresCallNumberRebuild(null));
    }

    @Test
    @DisplayName("Unknown order attributes should be rejected")
    void rejectsUnknownAttribute() {
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(
                Map.of("nypl", "945", "bpl", "907"), null, null, null,
                Map.of("960", Map.of("c", "not_an_attribute"))));
    }

    @Test
    @DisplayName("Missing bib id tags should be rejected")
    void rejectsMissingBibIdTag() {
        assertThrows(IllegalArgumentException.class,
                () -> new EngineConfig(Map.of("nypl", "945"), null, null, null, null));
    }

    @Test
    @DisplayName("Should load configuration from a file")
    void loadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"bibIdTags\": {\"nypl\": \"945\", \"bpl\": \"907\"}, \"extra\": 1}");

        EngineConfig config = loader.load(file);

        assertEquals("907", config.bibIdTag(LibrarySystem.BPL));
        assertTrue(config.orderFieldMappings().isEmpty());
    }

    @Test
    @DisplayName("Missing resources and files should fail loudly")
    void missingSources(@TempDir Path dir) {
        assertThrows(IllegalStateException.class, () -> loader.loadResource("missing.json"));
        assertThrows(UncheckedIOException.class, () -> loader.load(dir.resolve("missing.json")));
    }
}
