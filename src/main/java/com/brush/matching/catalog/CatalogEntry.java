package com.brush.matching.catalog;

import com.brush.matching.core.model.Fiber;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One compiled brand/model combination of the brush or knot catalog.
 * Brand-level entries (from {@code other_brushes}, {@code other_knots}, or brand
 * patterns in a model-keyed section) have no model.
 *
 * <p>Patterns are immutable and ordered by descending source length, so the most
 * specific pattern is always tried first.</p>
 */
public class CatalogEntry {
    private static final Comparator<CompiledPattern> LONGEST_FIRST =
            Comparator.comparingInt((CompiledPattern p) -> p.source().length()).reversed();

    private final CatalogSection section;
    private final String brand;
    private final String model;
    private final List<CompiledPattern> patterns;
    private final Fiber fiber;
    private final Fiber defaultFiber;
    private final Double knotSizeMm;
    private final boolean handleMatching;
    private final String handleMaker;
    private final String knotMaker;
    private final Map<String, Object> specification;

    private CatalogEntry(Builder builder) {
        this.section = builder.section;
        this.brand = builder.brand;
        this.model = builder.model;
        this.patterns = builder.patterns.stream().sorted(LONGEST_FIRST).toList();
        this.fiber = builder.fiber;
        this.defaultFiber = builder.defaultFiber;
        this.knotSizeMm = builder.knotSizeMm;
        this.handleMatching = builder.handleMatching;
        this.handleMaker = builder.handleMaker;
        this.knotMaker = builder.knotMaker;
        this.specification = Collections.unmodifiableMap(new LinkedHashMap<>(builder.specification));
    }

    public CatalogSection getSection() {
        return section;
    }

    public String getBrand() {
        return brand;
    }

    public String getModel() {
        return model;
    }

    public boolean isBrandLevel() {
        return model == null;
    }

    public List<CompiledPattern> getPatterns() {
        return patterns;
    }

    /**
     * Authoritative fiber declared with {@code fiber:}, or {@code null}.
     */
    public Fiber getFiber() {
        return fiber;
    }

    /**
     * Overridable fiber declared with {@code default:}, or {@code null}.
     */
    public Fiber getDefaultFiber() {
        return defaultFiber;
    }

    public Double getKnotSizeMm() {
        return knotSizeMm;
    }

    public boolean isHandleMatching() {
        return handleMatching;
    }

    public String getHandleMaker() {
        return handleMaker;
    }

    public String getKnotMaker() {
        return knotMaker;
    }

    /**
     * Any further scalar fields declared on the entry, in catalog order.
     */
    public Map<String, Object> getSpecification() {
        return specification;
    }

    /**
     * Returns the first pattern, longest first, that finds a match in the text.
     */
    public Optional<CompiledPattern> firstMatch(String text) {
        for (CompiledPattern pattern : patterns) {
            if (pattern.matches(text)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CatalogEntry that = (CatalogEntry) o;
        return section == that.section
                && Objects.equals(brand, that.brand)
                && Objects.equals(model, that.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(section, brand, model);
    }

    @Override
    public String toString() {
        return "CatalogEntry{" +
                "section=" + section.key() +
                ", brand='" + brand + '\'' +
                ", model='" + model + '\'' +
                ", patterns=" + patterns.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogSection section;
        private String brand;
        private String model;
        private List<CompiledPattern> patterns = List.of();
        private Fiber fiber;
        private Fiber defaultFiber;
        private Double knotSizeMm;
        private boolean handleMatching;
        private String handleMaker;
        private String knotMaker;
        private Map<String, Object> specification = new LinkedHashMap<>();

        public Builder section(CatalogSection section) {
            this.section = section;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder patterns(List<CompiledPattern> patterns) {
            this.patterns = List.copyOf(patterns);
            return this;
        }

        public Builder fiber(Fiber fiber) {
            this.fiber = fiber;
            return this;
        }

        public Builder defaultFiber(Fiber defaultFiber) {
            this.defaultFiber = defaultFiber;
            return this;
        }

        public Builder knotSizeMm(Double knotSizeMm) {
            this.knotSizeMm = knotSizeMm;
            return this;
        }

        public Builder handleMatching(boolean handleMatching) {
            this.handleMatching = handleMatching;
            return this;
        }

        public Builder handleMaker(String handleMaker) {
            this.handleMaker = handleMaker;
            return this;
        }

        public Builder knotMaker(String knotMaker) {
            this.knotMaker = knotMaker;
            return this;
        }

        public Builder specification(Map<String, Object> specification) {
            this.specification = new LinkedHashMap<>(specification);
            return this;
        }

        public CatalogEntry build() {
            Objects.requireNonNull(section, "section is required");
            Objects.requireNonNull(brand, "brand is required");
            if (patterns.isEmpty()) {
                throw CatalogException.at(section.key(), brand, model, "no patterns declared");
            }
            return new CatalogEntry(this);
        }
    }
}
