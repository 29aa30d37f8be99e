package com.brush.matching.component;

import java.util.Optional;

/**
 * Something that can identify a brand/model in text.
 */
public interface CatalogHitSource {

    /**
     * Looks for a brand/model in lowercase, normalized text.
     */
    Optional<CatalogHit> find(String text);

    /**
     * Stable name used in provenance and metrics.
     */
    String getName();
}
