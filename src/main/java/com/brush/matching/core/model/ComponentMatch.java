package com.brush.matching.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Handle or knot half of a brush match.
 *
 * @param brand      maker of the component
 * @param model      component model, when known
 * @param fiber      knot fiber (knots only)
 * @param knotSizeMm knot diameter (knots only)
 * @param sourceText text the component was matched from
 * @param pattern    catalog pattern that matched
 * @param section    catalog section the match came from
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComponentMatch(
        @JsonProperty("brand") String brand,
        @JsonProperty("model") String model,
        @JsonProperty("fiber") Fiber fiber,
        @JsonProperty("knot_size_mm") Double knotSizeMm,
        @JsonProperty("source_text") String sourceText,
        @JsonProperty("_pattern") String pattern,
        @JsonProperty("_section") String section
) {

    public static ComponentMatch handle(String maker, String model, String sourceText,
                                        String pattern, String section) {
        return new ComponentMatch(maker, model, null, null, sourceText, pattern, section);
    }

    public static ComponentMatch knot(String brand, String model, Fiber fiber, Double knotSizeMm,
                                      String sourceText, String pattern, String section) {
        return new ComponentMatch(brand, model, fiber, knotSizeMm, sourceText, pattern, section);
    }
}
