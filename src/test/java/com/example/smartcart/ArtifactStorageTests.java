package com.example.smartcart;

import com.example.smartcart.engine.SmartCartEngine;
import com.example.smartcart.model.*;
import com.example.smartcart.storage.ArtifactStorage;
import com.example.smartcart.storage.EngineSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.*;
import java.util.*;

public class ArtifactStorageTests {
    private final SmartCartEngine engine = new SmartCartEngine(new EngineSettings(),
            Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
    private final ArtifactStorage storage = new ArtifactStorage();

    private MenuSnapshot snapshot() {
        return engine.buildFromItems(List.of(
                List.of("10 pc Grilled Wings", "Regular Fries", "Ranch Dip"),
                List.of("10 pc Grilled Wings", "20oz Fountain Drink"),
                List.of("Veggie Sticks", "Blue Cheese Dip", "Spicy Veggie Wrap"),
                List.of("Regular Fries", "Chocolate Chip Cookie")), "orders.csv");
    }

    private static List<String> names(List<Recommendation> recs) {
        List<String> out = new ArrayList<>();
        for (Recommendation r : recs) out.add(r.name() + "@" + r.score);
        return out;
    }

    @Test
    void saved_snapshot_loads_back_with_identical_recommendations(@TempDir Path dir) throws Exception {
        MenuSnapshot original = snapshot();
        Path file = dir.resolve("nested/artifacts.json");
        storage.save(original, file);
        assertTrue(Files.exists(file));

        MenuSnapshot loaded = storage.load(file);
        assertEquals(original.snapshotKey, loaded.snapshotKey);
        assertEquals(original.builtAt, loaded.builtAt);
        assertEquals(original.orderCount, loaded.orderCount);
        assertEquals(original.affinities, loaded.affinities);
        assertEquals(original.catalog.items(), loaded.catalog.items());
        Item wrap = loaded.catalog.get("spicy veggie wrap");
        assertEquals(EnumSet.of(Attribute.VEGETARIAN, Attribute.SPICY), wrap.attributes);
        assertEquals(Category.MAIN, wrap.category);

        for (Item it : original.catalog.items()) {
            List<String> cart = List.of(it.name);
            assertEquals(names(engine.recommend(original, cart)), names(engine.recommend(loaded, cart)));
        }
    }

    @Test
    void missing_file_is_reported(@TempDir Path dir) {
        assertThrows(FileNotFoundException.class, () -> storage.load(dir.resolve("nope.json")));
    }

    @Test
    void corrupt_json_is_an_io_error() {
        IOException ex = assertThrows(IOException.class, () -> storage.load(stream("{not json")));
        assertTrue(ex.getMessage().contains("corrupt"));
    }

    @Test
    void other_format_versions_are_rejected(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("a.json");
        storage.save(snapshot(), file);
        String json = Files.readString(file).replaceFirst("\"formatVersion\"\\s*:\\s*1", "\"formatVersion\" : 99");
        IOException ex = assertThrows(IOException.class, () -> storage.load(stream(json)));
        assertTrue(ex.getMessage().contains("version"));
    }

    @Test
    void out_of_range_affinity_is_rejected() {
        String json = "{\"formatVersion\":1,\"items\":["
                + "{\"name\":\"Wings\",\"category\":\"main\",\"frequency\":1},"
                + "{\"name\":\"Fries\",\"category\":\"side\",\"frequency\":1}],"
                + "\"affinities\":{\"wings\":{\"fries\":1.5}}}";
        assertThrows(IOException.class, () -> storage.load(stream(json)));
    }

    @Test
    void null_attribute_is_an_io_error() {
        String json = "{\"formatVersion\":1,\"items\":["
                + "{\"name\":\"Wings\",\"category\":\"main\",\"attributes\":[null],\"frequency\":1}],"
                + "\"affinities\":{}}";
        assertThrows(IOException.class, () -> storage.load(stream(json)));
    }

    @Test
    void null_affinity_row_is_an_io_error() {
        String json = "{\"formatVersion\":1,\"items\":["
                + "{\"name\":\"Wings\",\"category\":\"main\",\"frequency\":1}],"
                + "\"affinities\":{\"wings\":null}}";
        assertThrows(IOException.class, () -> storage.load(stream(json)));
    }

    @Test
    void affinity_for_unknown_item_is_rejected() {
        String json = "{\"formatVersion\":1,\"items\":["
                + "{\"name\":\"Wings\",\"category\":\"main\",\"frequency\":1}],"
                + "\"affinities\":{\"wings\":{\"pizza\":0.5}}}";
        IOException ex = assertThrows(IOException.class, () -> storage.load(stream(json)));
        assertTrue(ex.getMessage().contains("pizza"));
    }

    @Test
    void ranking_that_disagrees_with_frequencies_is_rejected() {
        String json = "{\"formatVersion\":1,\"items\":["
                + "{\"name\":\"Fries\",\"category\":\"side\",\"frequency\":1},"
                + "{\"name\":\"Tots\",\"category\":\"side\",\"frequency\":5}],"
                + "\"topByCategory\":{\"side\":[\"Fries\",\"Tots\"]},"
                + "\"affinities\":{}}";
        assertThrows(IOException.class, () -> storage.load(stream(json)));
    }

    private static ByteArrayInputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
