package com.barthel.fragility.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Statistical families a fragility curve can be expressed in.
 * {@link #INHERIT} is a marker for components whose failure mode is fully
 * described by their subcomponents; it is never evaluated.
 */
public enum FragilityModel {
    LOGNORMAL,
    WEIBULL,
    LOGISTIC,
    INHERIT;

    /**
     * Resolve a stored model name, ignoring case and surrounding whitespace.
     *
     * @param name the model name as found on a curve document
     * @return the model, or empty if the name is unknown
     */
    public static Optional<FragilityModel> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(model -> model.name().equals(normalized))
                .findFirst();
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
