package com.brush.matching.catalog;

import com.brush.matching.core.model.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles raw catalog mappings into a {@link BrushCatalog}.
 *
 * <p>Brush and knot catalogs are keyed section, then brand, then model. Scalar
 * fields declared on a brand are inherited by its models unless the model
 * overrides them. Brand-level patterns produce a brand-level entry that is only
 * consulted after every model entry has failed.</p>
 *
 * <p>The handle catalog is keyed section, then maker, optionally then model.
 * Sections are prioritised by position: the first section has the highest
 * priority.</p>
 *
 * <p>Every pattern must compile; an invalid pattern fails compilation with a
 * {@link CatalogException} naming the section, brand, model and pattern.</p>
 */
public class CatalogCompiler {
    private static final Logger log = LoggerFactory.getLogger(CatalogCompiler.class);

    static final String PATTERNS = "patterns";
    static final String FIBER = "fiber";
    static final String DEFAULT = "default";
    static final String KNOT_SIZE = "knot_size_mm";
    static final String HANDLE_MATCHING = "handle_matching";
    static final String HANDLE_MAKER = "handle_maker";
    static final String KNOT_MAKER = "knot_maker";
    private static final Set<String> RESERVED = Set.of(
            PATTERNS, FIBER, DEFAULT, KNOT_SIZE, HANDLE_MATCHING, HANDLE_MAKER, KNOT_MAKER);

    private static final int MAX_HANDLE_PRIORITY = 3;

    /**
     * Compiles the three catalogs.
     *
     * @param brushes brush catalog mapping
     * @param knots   knot catalog mapping
     * @param handles handle catalog mapping
     */
    public BrushCatalog compile(Map<String, Object> brushes,
                                Map<String, Object> knots,
                                Map<String, Object> handles) {
        Map<CatalogSection, List<CatalogEntry>> sections = new EnumMap<>(CatalogSection.class);
        Set<String> slashNames = new LinkedHashSet<>();

        compileFile("brushes", brushes, List.of(CatalogSection.KNOWN_BRUSHES,
                CatalogSection.DECLARATION_GROOMING, CatalogSection.OTHER_BRUSHES), sections, slashNames);
        compileFile("knots", knots, List.of(CatalogSection.KNOWN_KNOTS,
                CatalogSection.OTHER_KNOTS), sections, slashNames);
        List<HandlePatternEntry> handleEntries = compileHandles(handles, slashNames);

        BrushCatalog catalog = new BrushCatalog(sections, handleEntries, slashNames);
        log.info("catalog.compiled entries={} handles={} slashNames={}",
                catalog.size() - handleEntries.size(), handleEntries.size(), slashNames.size());
        return catalog;
    }

    private void compileFile(String fileLabel, Map<String, Object> raw, List<CatalogSection> expected,
                             Map<CatalogSection, List<CatalogEntry>> sections, Set<String> slashNames) {
        Map<String, CatalogSection> byKey = new LinkedHashMap<>();
        expected.forEach(s -> byKey.put(s.key(), s));

        for (Map.Entry<String, Object> top : raw.entrySet()) {
            CatalogSection section = byKey.get(top.getKey());
            if (section == null) {
                log.warn("catalog.section.ignored file={} section={}", fileLabel, top.getKey());
                continue;
            }
            List<CatalogEntry> entries = compileSection(section, top.getValue());
            sections.put(section, entries);
            for (CatalogEntry entry : entries) {
                addSlashName(slashNames, entry.getBrand());
                addSlashName(slashNames, entry.getModel());
            }
        }
    }

    List<CatalogEntry> compileSection(CatalogSection section, Object raw) {
        Map<String, Object> brands = YamlMaps.asMapping(raw, section.key());
        List<CatalogEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Object> brandEntry : brands.entrySet()) {
            String brand = brandEntry.getKey();
            Map<String, Object> brandFields = YamlMaps.asMapping(brandEntry.getValue(),
                    section.key() + "." + brand);
            if (section.isBrandLevel()) {
                entries.add(compileBrandLevel(section, brand, brandFields));
            } else {
                entries.addAll(compileModels(section, brand, brandFields));
            }
        }
        return entries;
    }

    private CatalogEntry compileBrandLevel(CatalogSection section, String brand, Map<String, Object> fields) {
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            if (field.getValue() instanceof Map<?, ?>) {
                throw CatalogException.at(section.key(), brand, null,
                        "unexpected nested mapping '" + field.getKey() + "' in a brand-level section");
            }
        }
        return buildEntry(section, brand, null, fields);
    }

    private List<CatalogEntry> compileModels(CatalogSection section, String brand, Map<String, Object> fields) {
        Map<String, Object> inherited = new LinkedHashMap<>();
        Map<String, Map<String, Object>> models = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            if (field.getValue() instanceof Map<?, ?>) {
                models.put(field.getKey(), YamlMaps.asMapping(field.getValue(),
                        section.key() + "." + brand + "." + field.getKey()));
            } else if (!PATTERNS.equals(field.getKey())) {
                inherited.put(field.getKey(), field.getValue());
            }
        }

        List<CatalogEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> model : models.entrySet()) {
            Map<String, Object> merged = new LinkedHashMap<>(inherited);
            merged.putAll(model.getValue());
            entries.add(buildEntry(section, brand, model.getKey(), merged));
        }
        if (fields.containsKey(PATTERNS)) {
            entries.add(buildEntry(section, brand, null, fields.entrySet().stream()
                    .filter(e -> !(e.getValue() instanceof Map<?, ?>))
                    .collect(LinkedHashMap::new, (m, e) -> m.put(e.getKey(), e.getValue()), Map::putAll)));
        }
        if (entries.isEmpty()) {
            throw CatalogException.at(section.key(), brand, null, "brand declares neither models nor patterns");
        }
        return entries;
    }

    private CatalogEntry buildEntry(CatalogSection section, String brand, String model, Map<String, Object> fields) {
        CatalogEntry.Builder builder = CatalogEntry.builder()
                .section(section)
                .brand(brand)
                .model(model)
                .patterns(compilePatterns(section.key(), brand, model, fields.get(PATTERNS)));

        Map<String, Object> specification = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            String key = field.getKey();
            Object value = field.getValue();
            switch (key) {
                case PATTERNS -> { }
                case FIBER -> builder.fiber(parseFiber(section, brand, model, value));
                case DEFAULT -> builder.defaultFiber(parseFiber(section, brand, model, value));
                case KNOT_SIZE -> builder.knotSizeMm(parseSize(section, brand, model, value));
                case HANDLE_MATCHING -> builder.handleMatching(parseBoolean(section, brand, model, value));
                case HANDLE_MAKER -> builder.handleMaker(value != null ? value.toString() : null);
                case KNOT_MAKER -> builder.knotMaker(value != null ? value.toString() : null);
                default -> specification.put(key, value);
            }
        }
        return builder.specification(specification).build();
    }

    private List<HandlePatternEntry> compileHandles(Map<String, Object> handles, Set<String> slashNames) {
        List<HandlePatternEntry> entries = new ArrayList<>();
        int index = 0;
        for (Map.Entry<String, Object> sectionEntry : handles.entrySet()) {
            String section = sectionEntry.getKey();
            int priority = Math.max(0, MAX_HANDLE_PRIORITY - index++);
            Map<String, Object> makers = YamlMaps.asMapping(sectionEntry.getValue(), "handles." + section);
            for (Map.Entry<String, Object> makerEntry : makers.entrySet()) {
                String maker = makerEntry.getKey();
                addSlashName(slashNames, maker);
                Map<String, Object> fields = YamlMaps.asMapping(makerEntry.getValue(),
                        "handles." + section + "." + maker);
                int before = entries.size();
                for (Map.Entry<String, Object> field : fields.entrySet()) {
                    if (field.getValue() instanceof Map<?, ?> modelFields) {
                        String model = field.getKey();
                        entries.add(new HandlePatternEntry(maker, model, section, priority,
                                compilePatterns("handles." + section, maker, model, modelFields.get(PATTERNS))));
                    }
                }
                if (fields.containsKey(PATTERNS)) {
                    entries.add(new HandlePatternEntry(maker, null, section, priority,
                            compilePatterns("handles." + section, maker, null, fields.get(PATTERNS))));
                }
                if (entries.size() == before) {
                    throw CatalogException.at("handles." + section, maker, null,
                            "maker declares neither models nor patterns");
                }
            }
        }
        List<HandlePatternEntry> ordered = new ArrayList<>(entries);
        ordered.sort((a, b) -> Integer.compare(b.priority(), a.priority()));
        return ordered;
    }

    private List<CompiledPattern> compilePatterns(String section, String brand, String model, Object raw) {
        if (raw == null) {
            throw CatalogException.at(section, brand, model, "no patterns declared");
        }
        if (!(raw instanceof List<?> list)) {
            throw CatalogException.at(section, brand, model, "patterns must be a list");
        }
        List<CompiledPattern> compiled = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item == null) {
                throw CatalogException.at(section, brand, model, "null pattern");
            }
            String source = item.toString();
            try {
                compiled.add(CompiledPattern.compile(source));
            } catch (PatternSyntaxException e) {
                throw CatalogException.invalidPattern(section, brand, model, source, e);
            }
        }
        return compiled;
    }

    private Fiber parseFiber(CatalogSection section, String brand, String model, Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Fiber.fromCatalog(value.toString());
        } catch (IllegalArgumentException e) {
            throw CatalogException.at(section.key(), brand, model, e.getMessage());
        }
    }

    private Double parseSize(CatalogSection section, String brand, String model, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw CatalogException.at(section.key(), brand, model, "knot_size_mm must be numeric, got '" + value + "'");
    }

    private boolean parseBoolean(CatalogSection section, String brand, String model, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw CatalogException.at(section.key(), brand, model, "handle_matching must be true or false");
    }

    private static void addSlashName(Set<String> slashNames, String name) {
        if (name != null && name.indexOf('/') >= 0) {
            slashNames.add(name.toLowerCase(Locale.ROOT));
        }
    }
}
