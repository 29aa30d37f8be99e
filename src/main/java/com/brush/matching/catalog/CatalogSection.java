package com.brush.matching.catalog;

/**
 * Named sections of the brush and knot catalogs.
 */
public enum CatalogSection {
    KNOWN_BRUSHES("known_brushes", false),
    DECLARATION_GROOMING("declaration_grooming", false),
    OTHER_BRUSHES("other_brushes", true),
    KNOWN_KNOTS("known_knots", false),
    OTHER_KNOTS("other_knots", true);

    private final String key;
    private final boolean brandLevel;

    CatalogSection(String key, boolean brandLevel) {
        this.key = key;
        this.brandLevel = brandLevel;
    }

    /**
     * The section's key in the YAML file.
     */
    public String key() {
        return key;
    }

    /**
     * True if entries in this section are keyed by brand only.
     */
    public boolean isBrandLevel() {
        return brandLevel;
    }
}
