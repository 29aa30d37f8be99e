package com.brush.matching.correct;

import com.brush.matching.catalog.CatalogException;
import com.brush.matching.catalog.YamlMaps;
import com.brush.matching.core.model.Fiber;
import com.brush.matching.rules.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable correct-match overrides, looked up by exact lowercase text.
 *
 * <p>Sections of {@code correct_matches.yaml}:</p>
 * <pre>
 * brush:        brand  -&gt; model -&gt; [strings]
 * handle:       maker  -&gt; model -&gt; [strings]
 * knot:         brand  -&gt; model -&gt; [strings] | {strings, fiber, knot_size_mm}
 * split_brush:  string -&gt; {handle, knot}
 * </pre>
 */
public class CorrectMatchTable {
    private static final Logger log = LoggerFactory.getLogger(CorrectMatchTable.class);

    static final String BRUSH = "brush";
    static final String HANDLE = "handle";
    static final String KNOT = "knot";
    static final String SPLIT_BRUSH = "split_brush";

    private final Map<String, CorrectMatchEntry> brushes;
    private final Map<String, CorrectMatchEntry> handles;
    private final Map<String, CorrectMatchEntry> knots;
    private final Map<String, CorrectMatchEntry> splits;

    private CorrectMatchTable(Map<String, CorrectMatchEntry> brushes, Map<String, CorrectMatchEntry> handles,
                              Map<String, CorrectMatchEntry> knots, Map<String, CorrectMatchEntry> splits) {
        this.brushes = Map.copyOf(brushes);
        this.handles = Map.copyOf(handles);
        this.knots = Map.copyOf(knots);
        this.splits = Map.copyOf(splits);
    }

    public static CorrectMatchTable empty() {
        return new CorrectMatchTable(Map.of(), Map.of(), Map.of(), Map.of());
    }

    /**
     * Builds the table from a parsed {@code correct_matches.yaml}.
     *
     * @throws CatalogException if the mapping is malformed or a key repeats within a section
     */
    public static CorrectMatchTable fromMapping(Map<String, Object> raw) {
        Map<String, CorrectMatchEntry> brushes = new LinkedHashMap<>();
        Map<String, CorrectMatchEntry> handles = new LinkedHashMap<>();
        Map<String, CorrectMatchEntry> knots = new LinkedHashMap<>();
        Map<String, CorrectMatchEntry> splits = new LinkedHashMap<>();

        for (Map.Entry<String, Object> section : raw.entrySet()) {
            switch (section.getKey()) {
                case BRUSH -> readModelSection(BRUSH, section.getValue(), brushes);
                case HANDLE -> readModelSection(HANDLE, section.getValue(), handles);
                case KNOT -> readModelSection(KNOT, section.getValue(), knots);
                case SPLIT_BRUSH -> readSplits(section.getValue(), splits);
                default -> log.warn("correct_matches.section.ignored section={}", section.getKey());
            }
        }
        CorrectMatchTable table = new CorrectMatchTable(brushes, handles, knots, splits);
        log.info("correct_matches.loaded brush={} handle={} knot={} split={}",
                brushes.size(), handles.size(), knots.size(), splits.size());
        return table;
    }

    public Optional<CorrectMatchEntry> findBrush(String key) {
        return Optional.ofNullable(brushes.get(key));
    }

    public Optional<CorrectMatchEntry> findHandle(String key) {
        return Optional.ofNullable(handles.get(key));
    }

    public Optional<CorrectMatchEntry> findKnot(String key) {
        return Optional.ofNullable(knots.get(key));
    }

    public Optional<CorrectMatchEntry> findSplit(String key) {
        return Optional.ofNullable(splits.get(key));
    }

    public Collection<CorrectMatchEntry> splits() {
        return splits.values();
    }

    public int size() {
        return brushes.size() + handles.size() + knots.size() + splits.size();
    }

    private static void readModelSection(String section, Object raw, Map<String, CorrectMatchEntry> target) {
        Map<String, Object> brands = YamlMaps.asMapping(raw, "correct_matches." + section);
        for (Map.Entry<String, Object> brandEntry : brands.entrySet()) {
            String brand = brandEntry.getKey();
            Map<String, Object> models = YamlMaps.asMapping(brandEntry.getValue(),
                    "correct_matches." + section + "." + brand);
            for (Map.Entry<String, Object> modelEntry : models.entrySet()) {
                String model = modelEntry.getKey();
                Object value = modelEntry.getValue();
                String where = "correct_matches." + section + "." + brand + "." + model;

                List<?> strings;
                Fiber fiber = null;
                Double knotSize = null;
                if (value instanceof List<?> list) {
                    strings = list;
                } else if (value instanceof Map<?, ?>) {
                    Map<String, Object> fields = YamlMaps.asMapping(value, where);
                    if (!(fields.get("strings") instanceof List<?> list)) {
                        throw new CatalogException(where + ": 'strings' must be a list");
                    }
                    strings = list;
                    fiber = parseFiber(where, fields.get("fiber"));
                    knotSize = parseSize(where, fields.get("knot_size_mm"));
                } else {
                    throw new CatalogException(where + ": expected a list of strings or a mapping");
                }

                for (Object item : strings) {
                    if (item == null) {
                        throw new CatalogException(where + ": null string");
                    }
                    String key = TextNormalizer.normalize(item.toString());
                    CorrectMatchEntry entry = switch (section) {
                        case BRUSH -> CorrectMatchEntry.brush(key, brand, model);
                        case HANDLE -> CorrectMatchEntry.handle(key, brand, model);
                        default -> CorrectMatchEntry.knot(key, brand, model, fiber, knotSize);
                    };
                    putUnique(where, target, key, entry);
                }
            }
        }
    }

    private static void readSplits(Object raw, Map<String, CorrectMatchEntry> target) {
        Map<String, Object> entries = YamlMaps.asMapping(raw, "correct_matches." + SPLIT_BRUSH);
        for (Map.Entry<String, Object> splitEntry : entries.entrySet()) {
            String where = "correct_matches." + SPLIT_BRUSH + "." + splitEntry.getKey();
            Map<String, Object> fields = YamlMaps.asMapping(splitEntry.getValue(), where);
            Object handle = fields.get("handle");
            Object knot = fields.get("knot");
            if (handle == null && knot == null) {
                throw new CatalogException(where + ": split needs a handle or a knot");
            }
            String key = TextNormalizer.normalize(splitEntry.getKey());
            putUnique(where, target, key, CorrectMatchEntry.split(key,
                    handle != null ? handle.toString() : null,
                    knot != null ? knot.toString() : null));
        }
    }

    private static void putUnique(String where, Map<String, CorrectMatchEntry> target, String key,
                                  CorrectMatchEntry entry) {
        CorrectMatchEntry previous = target.putIfAbsent(key, entry);
        if (previous != null) {
            throw new CatalogException(where + ": duplicate correct-match string '" + key + "'");
        }
    }

    private static Fiber parseFiber(String where, Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Fiber.fromCatalog(value.toString());
        } catch (IllegalArgumentException e) {
            throw new CatalogException(where + ": " + e.getMessage(), e);
        }
    }

    private static Double parseSize(String where, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new CatalogException(where + ": knot_size_mm must be numeric");
    }
}
