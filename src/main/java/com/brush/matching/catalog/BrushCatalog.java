package com.brush.matching.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiled, immutable brush, knot and handle catalogs.
 * Built once per matcher and shared read-only by every strategy.
 */
public class BrushCatalog {
    private static final List<CatalogSection> BRUSH_SECTIONS = List.of(
            CatalogSection.KNOWN_BRUSHES, CatalogSection.DECLARATION_GROOMING, CatalogSection.OTHER_BRUSHES);
    private static final List<CatalogSection> KNOT_SECTIONS = List.of(
            CatalogSection.KNOWN_KNOTS, CatalogSection.OTHER_KNOTS);

    private final Map<CatalogSection, List<CatalogEntry>> sections;
    private final List<HandlePatternEntry> handles;
    private final Set<String> slashNames;

    public BrushCatalog(Map<CatalogSection, List<CatalogEntry>> sections,
                        List<HandlePatternEntry> handles,
                        Set<String> slashNames) {
        EnumMap<CatalogSection, List<CatalogEntry>> copy = new EnumMap<>(CatalogSection.class);
        for (CatalogSection section : CatalogSection.values()) {
            copy.put(section, List.copyOf(sections.getOrDefault(section, List.of())));
        }
        this.sections = Collections.unmodifiableMap(copy);
        this.handles = List.copyOf(handles);
        this.slashNames = Set.copyOf(slashNames);
    }

    public static BrushCatalog empty() {
        return new BrushCatalog(Map.of(), List.of(), Set.of());
    }

    /**
     * All entries of a section in catalog order.
     */
    public List<CatalogEntry> entries(CatalogSection section) {
        return sections.get(section);
    }

    /**
     * Model-level entries of a section in catalog order.
     */
    public List<CatalogEntry> modelEntries(CatalogSection section) {
        return sections.get(section).stream().filter(e -> !e.isBrandLevel()).toList();
    }

    /**
     * Brand-level entries of a section in catalog order.
     */
    public List<CatalogEntry> brandEntries(CatalogSection section) {
        return sections.get(section).stream().filter(CatalogEntry::isBrandLevel).toList();
    }

    /**
     * Handle entries ordered by descending section priority, then catalog order.
     */
    public List<HandlePatternEntry> handles() {
        return handles;
    }

    /**
     * Lowercase brand and model names that contain a slash.
     */
    public Set<String> slashNames() {
        return slashNames;
    }

    /**
     * Finds a brush entry by name; falls back to the brand-level entry when the
     * model is not catalogued.
     */
    public Optional<CatalogEntry> findBrush(String brand, String model) {
        return find(BRUSH_SECTIONS, brand, model);
    }

    /**
     * Finds a knot entry by name; falls back to the brand-level entry when the
     * model is not catalogued.
     */
    public Optional<CatalogEntry> findKnot(String brand, String model) {
        return find(KNOT_SECTIONS, brand, model);
    }

    public int size() {
        int total = handles.size();
        for (List<CatalogEntry> entries : sections.values()) {
            total += entries.size();
        }
        return total;
    }

    private Optional<CatalogEntry> find(List<CatalogSection> searchOrder, String brand, String model) {
        if (brand == null) {
            return Optional.empty();
        }
        List<CatalogEntry> brandLevel = new ArrayList<>();
        for (CatalogSection section : searchOrder) {
            for (CatalogEntry entry : sections.get(section)) {
                if (!entry.getBrand().equalsIgnoreCase(brand)) {
                    continue;
                }
                if (entry.isBrandLevel()) {
                    brandLevel.add(entry);
                } else if (model != null && entry.getModel().equalsIgnoreCase(model)) {
                    return Optional.of(entry);
                }
            }
        }
        return brandLevel.stream().findFirst();
    }
}
