package com.example.smartcart.storage;

import com.example.smartcart.model.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Saves and loads a {@link MenuSnapshot} as a JSON bundle. Loading checks the
 * format version and the internal consistency of the bundle, so a truncated or
 * hand-edited file fails here rather than producing odd recommendations.
 */
public class ArtifactStorage {
    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .registerModule(new JavaTimeModule());

    public static class Bundle {
        public int formatVersion;
        public String snapshotKey;
        public java.time.Instant builtAt;
        public long orderCount;
        public long sampledOrderCount;
        public List<ItemEntry> items = new ArrayList<>();
        public Map<String, List<String>> topByCategory = new LinkedHashMap<>();
        public Map<String, Map<String, Double>> affinities = new LinkedHashMap<>();
    }

    public static class ItemEntry {
        public String name;
        public String category;
        public List<String> attributes = new ArrayList<>();
        public long frequency;

        public ItemEntry() {}
        public ItemEntry(String name, String category, List<String> attributes, long frequency) {
            this.name = name; this.category = category; this.attributes = attributes; this.frequency = frequency;
        }
    }

    public void save(MenuSnapshot snapshot, Path file) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) Files.createDirectories(dir);
        try (OutputStream out = Files.newOutputStream(file)) {
            save(snapshot, out);
        }
    }

    public void save(MenuSnapshot snapshot, OutputStream out) throws IOException {
        mapper.writeValue(out, toBundle(snapshot));
    }

    public MenuSnapshot load(Path file) throws IOException {
        if (!Files.exists(file)) throw new FileNotFoundException("Artifact not found: " + file + ". Run the build command first.");
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public MenuSnapshot load(InputStream in) throws IOException {
        Bundle b;
        try {
            b = mapper.readValue(in, Bundle.class);
        } catch (IOException ex) {
            throw new IOException("Failed to parse artifact JSON. The file is corrupt or not a SmartCart bundle.", ex);
        }
        return fromBundle(b);
    }

    Bundle toBundle(MenuSnapshot s) {
        Bundle b = new Bundle();
        b.formatVersion = FORMAT_VERSION;
        b.snapshotKey = s.snapshotKey;
        b.builtAt = s.builtAt;
        b.orderCount = s.orderCount;
        b.sampledOrderCount = s.sampledOrderCount;
        for (Item it : s.catalog.items()) {
            List<String> attrs = new ArrayList<>();
            for (Attribute a : it.attributes) attrs.add(a.label());
            b.items.add(new ItemEntry(it.name, it.category.label(), attrs, s.catalog.frequency(it)));
        }
        for (var e : s.catalog.topByCategory().entrySet()) {
            List<String> names = new ArrayList<>();
            for (RankedItem r : e.getValue()) names.add(r.item.name);
            b.topByCategory.put(e.getKey().label(), names);
        }
        b.affinities = s.affinities.rows();
        return b;
    }

    MenuSnapshot fromBundle(Bundle b) throws IOException {
        if (b == null) throw new IOException("Artifact is empty.");
        if (b.formatVersion != FORMAT_VERSION) {
            throw new IOException("Unsupported artifact format version " + b.formatVersion + " (expected " + FORMAT_VERSION + "). Rebuild the artifact.");
        }
        if (b.items == null || b.affinities == null) throw new IOException("Artifact is missing items or affinities.");

        List<Item> items = new ArrayList<>(b.items.size());
        Map<String, Long> freq = new HashMap<>();
        for (int i = 0; i < b.items.size(); i++) {
            ItemEntry e = b.items.get(i);
            if (e == null || e.name == null || e.name.isBlank()) throw new IOException("Artifact item #" + i + " has no name.");
            EnumSet<Attribute> attrs = EnumSet.noneOf(Attribute.class);
            if (e.attributes != null) {
                for (String a : e.attributes) {
                    if (a == null) throw new IOException("Artifact item '" + e.name + "' has a null attribute.");
                    try {
                        attrs.add(Attribute.valueOf(a.trim().toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException ex) {
                        throw new IOException("Artifact item '" + e.name + "' has unknown attribute '" + a + "'.", ex);
                    }
                }
            }
            Item it = new Item(e.name, Category.fromLabel(e.category), attrs, i);
            items.add(it);
            freq.put(it.key(), e.frequency);
        }

        Catalog catalog;
        AffinityMatrix matrix;
        try {
            catalog = new Catalog(items, freq);
            matrix = new AffinityMatrix(b.affinities);
        } catch (IllegalArgumentException ex) {
            throw new IOException("Artifact content is inconsistent: " + ex.getMessage(), ex);
        }
        for (var row : matrix.rows().entrySet()) {
            if (catalog.get(row.getKey()) == null) throw new IOException("Affinity row for unknown item '" + row.getKey() + "'.");
            for (String to : row.getValue().keySet()) {
                if (catalog.get(to) == null) throw new IOException("Affinity target '" + to + "' is not in the catalog.");
            }
        }
        checkRankings(b, catalog);
        return new MenuSnapshot(b.snapshotKey, b.builtAt, b.orderCount, b.sampledOrderCount, catalog, matrix);
    }

    private static void checkRankings(Bundle b, Catalog catalog) throws IOException {
        if (b.topByCategory == null) return;
        for (var e : b.topByCategory.entrySet()) {
            List<RankedItem> ranked = catalog.topByCategory(Category.fromLabel(e.getKey()));
            List<String> expected = new ArrayList<>();
            for (RankedItem r : ranked) expected.add(r.item.name);
            if (!expected.equals(e.getValue())) {
                throw new IOException("Stored ranking for category '" + e.getKey() + "' does not match item frequencies.");
            }
        }
    }
}
