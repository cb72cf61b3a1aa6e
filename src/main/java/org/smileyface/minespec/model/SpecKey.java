package org.smileyface.minespec.model;

import java.util.Objects;

/**
 * Identity of one reconciled record: a parameter of a given brand and model.
 */
public record SpecKey(String brand, String model, String parameterName) {

    public SpecKey {
        Objects.requireNonNull(brand, "brand");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(parameterName, "parameterName");
    }

    public static SpecKey of(ExtractionCandidate c) {
        return new SpecKey(c.getBrand(), c.getModel(), c.getParameterName());
    }

    /** Stable string form, usable as a document id. */
    public String id() {
        return brand + "|" + model + "|" + parameterName;
    }
}
