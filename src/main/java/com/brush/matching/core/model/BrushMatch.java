package com.brush.matching.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The matched brush record of a {@link MatchResult}.
 * Carries the identifying fields, every specification field declared on the
 * matched catalog entry, the handle and knot components and the match provenance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"brand", "model", "fiber", "knot_size_mm", "handle_maker", "handle_model",
        "knot_maker", "fiber_strategy", "fiber_conflict", "handle", "knot"})
public class BrushMatch {
    private final String brand;
    private final String model;
    private final Fiber fiber;
    private final Double knotSizeMm;
    private final String handleMaker;
    private final String handleModel;
    private final String knotMaker;
    private final FiberStrategy fiberStrategy;
    private final String fiberConflict;
    private final Map<String, Object> specification;
    private final ComponentMatch handle;
    private final ComponentMatch knot;
    private final MatchProvenance provenance;

    private BrushMatch(Builder builder) {
        this.brand = builder.brand;
        this.model = builder.model;
        this.fiber = builder.fiber;
        this.knotSizeMm = builder.knotSizeMm;
        this.handleMaker = builder.handleMaker;
        this.handleModel = builder.handleModel;
        this.knotMaker = builder.knotMaker;
        this.fiberStrategy = builder.fiberStrategy;
        this.fiberConflict = builder.fiberConflict;
        this.specification = Collections.unmodifiableMap(new LinkedHashMap<>(builder.specification));
        this.handle = builder.handle;
        this.knot = builder.knot;
        this.provenance = builder.provenance;
    }

    @JsonProperty("brand")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public String getBrand() {
        return brand;
    }

    @JsonProperty("model")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public String getModel() {
        return model;
    }

    @JsonProperty("fiber")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Fiber getFiber() {
        return fiber;
    }

    @JsonProperty("knot_size_mm")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Double getKnotSizeMm() {
        return knotSizeMm;
    }

    @JsonProperty("handle_maker")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public String getHandleMaker() {
        return handleMaker;
    }

    @JsonProperty("handle_model")
    public String getHandleModel() {
        return handleModel;
    }

    @JsonProperty("knot_maker")
    public String getKnotMaker() {
        return knotMaker;
    }

    @JsonProperty("fiber_strategy")
    public FiberStrategy getFiberStrategy() {
        return fiberStrategy;
    }

    @JsonProperty("fiber_conflict")
    public String getFiberConflict() {
        return fiberConflict;
    }

    /**
     * Catalog-declared specification fields, in catalog order.
     */
    @JsonAnyGetter
    public Map<String, Object> getSpecification() {
        return specification;
    }

    @JsonProperty("handle")
    public ComponentMatch getHandle() {
        return handle;
    }

    @JsonProperty("knot")
    public ComponentMatch getKnot() {
        return knot;
    }

    @JsonUnwrapped
    public MatchProvenance getProvenance() {
        return provenance;
    }

    public Builder toBuilder() {
        return new Builder()
                .brand(brand)
                .model(model)
                .fiber(fiber)
                .knotSizeMm(knotSizeMm)
                .handleMaker(handleMaker)
                .handleModel(handleModel)
                .knotMaker(knotMaker)
                .fiberStrategy(fiberStrategy)
                .fiberConflict(fiberConflict)
                .specification(specification)
                .handle(handle)
                .knot(knot)
                .provenance(provenance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BrushMatch that = (BrushMatch) o;
        return Objects.equals(brand, that.brand)
                && Objects.equals(model, that.model)
                && fiber == that.fiber
                && Objects.equals(knotSizeMm, that.knotSizeMm)
                && Objects.equals(handleMaker, that.handleMaker)
                && Objects.equals(handleModel, that.handleModel)
                && Objects.equals(knotMaker, that.knotMaker)
                && fiberStrategy == that.fiberStrategy
                && Objects.equals(fiberConflict, that.fiberConflict)
                && Objects.equals(specification, that.specification)
                && Objects.equals(handle, that.handle)
                && Objects.equals(knot, that.knot)
                && Objects.equals(provenance, that.provenance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(brand, model, fiber, knotSizeMm, handleMaker, handleModel, knotMaker,
                fiberStrategy, fiberConflict, specification, handle, knot, provenance);
    }

    @Override
    public String toString() {
        return "BrushMatch{" +
                "brand='" + brand + '\'' +
                ", model='" + model + '\'' +
                ", fiber=" + fiber +
                ", knotSizeMm=" + knotSizeMm +
                ", handleMaker='" + handleMaker + '\'' +
                ", strategy=" + (provenance != null ? provenance.strategy() : null) +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String brand;
        private String model;
        private Fiber fiber;
        private Double knotSizeMm;
        private String handleMaker;
        private String handleModel;
        private String knotMaker;
        private FiberStrategy fiberStrategy;
        private String fiberConflict;
        private Map<String, Object> specification = new LinkedHashMap<>();
        private ComponentMatch handle;
        private ComponentMatch knot;
        private MatchProvenance provenance;

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder fiber(Fiber fiber) {
            this.fiber = fiber;
            return this;
        }

        public Builder knotSizeMm(Double knotSizeMm) {
            this.knotSizeMm = knotSizeMm;
            return this;
        }

        public Builder handleMaker(String handleMaker) {
            this.handleMaker = handleMaker;
            return this;
        }

        public Builder handleModel(String handleModel) {
            this.handleModel = handleModel;
            return this;
        }

        public Builder knotMaker(String knotMaker) {
            this.knotMaker = knotMaker;
            return this;
        }

        public Builder fiberStrategy(FiberStrategy fiberStrategy) {
            this.fiberStrategy = fiberStrategy;
            return this;
        }

        public Builder fiberConflict(String fiberConflict) {
            this.fiberConflict = fiberConflict;
            return this;
        }

        public Builder specification(Map<String, Object> specification) {
            this.specification = specification != null ? new LinkedHashMap<>(specification) : new LinkedHashMap<>();
            return this;
        }

        public Builder handle(ComponentMatch handle) {
            this.handle = handle;
            return this;
        }

        public Builder knot(ComponentMatch knot) {
            this.knot = knot;
            return this;
        }

        public Builder provenance(MatchProvenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public BrushMatch build() {
            Objects.requireNonNull(provenance, "provenance is required");
            return new BrushMatch(this);
        }
    }
}
