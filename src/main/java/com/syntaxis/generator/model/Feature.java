package com.syntaxis.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A grammatical value ("nom") and the category it belongs to ("case").
 */
@Value
public class Feature {

    /** Suffix marking a value that leaves its category unconstrained. */
    public static final String WILDCARD_SUFFIX = "*";

    @NonNull
    String name;

    @NonNull
    FeatureCategory category;

    public static Feature of(String name, FeatureCategory category) {
        return new Feature(name, category);
    }

    public boolean isWildcard() {
        return name.endsWith(WILDCARD_SUFFIX);
    }

    @Override
    public String toString() {
        return category + ":" + name;
    }
}
