package com.brush.matching.catalog;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Locations of the catalog and override files.
 * The override files are optional: a {@code null} path means "not configured",
 * whereas a configured path that does not exist is a configuration error.
 *
 * @param brushes        brush catalog ({@code brushes.yaml})
 * @param knots          knot catalog ({@code knots.yaml})
 * @param handles        handle maker catalog ({@code handles.yaml})
 * @param correctMatches correct-match overrides ({@code correct_matches.yaml}), may be null
 * @param brushSplits    curated split table ({@code brush_splits.yaml}), may be null
 */
public record CatalogPaths(Path brushes, Path knots, Path handles, Path correctMatches, Path brushSplits) {

    public static final String BRUSHES_FILE = "brushes.yaml";
    public static final String KNOTS_FILE = "knots.yaml";
    public static final String HANDLES_FILE = "handles.yaml";
    public static final String CORRECT_MATCHES_FILE = "correct_matches.yaml";
    public static final String BRUSH_SPLITS_FILE = "brush_splits.yaml";

    public CatalogPaths {
        Objects.requireNonNull(brushes, "brushes path is required");
        Objects.requireNonNull(knots, "knots path is required");
        Objects.requireNonNull(handles, "handles path is required");
    }

    /**
     * All five files under their standard names in one directory.
     */
    public static CatalogPaths inDirectory(Path directory) {
        return new CatalogPaths(
                directory.resolve(BRUSHES_FILE),
                directory.resolve(KNOTS_FILE),
                directory.resolve(HANDLES_FILE),
                directory.resolve(CORRECT_MATCHES_FILE),
                directory.resolve(BRUSH_SPLITS_FILE));
    }

    /**
     * Catalogs only, without override files.
     */
    public static CatalogPaths catalogsOnly(Path directory) {
        return new CatalogPaths(
                directory.resolve(BRUSHES_FILE),
                directory.resolve(KNOTS_FILE),
                directory.resolve(HANDLES_FILE),
                null,
                null);
    }
}
