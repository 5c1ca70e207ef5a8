package com.syntaxis.generator.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;

/**
 * Immutable, insertion-ordered set of features holding at most one feature per category.
 *
 * Equality ignores order: two sets are equal when they hold the same features.
 */
@EqualsAndHashCode
public final class FeatureSet {

    private static final FeatureSet EMPTY = new FeatureSet(new LinkedHashMap<>());

    private final Map<FeatureCategory, Feature> byCategory;

    private FeatureSet(LinkedHashMap<FeatureCategory, Feature> byCategory) {
        this.byCategory = Collections.unmodifiableMap(byCategory);
    }

    public static FeatureSet empty() {
        return EMPTY;
    }

    public static FeatureSet of(Feature... features) {
        return of(List.of(features));
    }

    /**
     * @throws IllegalArgumentException if two features share a category
     */
    public static FeatureSet of(Collection<Feature> features) {
        LinkedHashMap<FeatureCategory, Feature> map = new LinkedHashMap<>();
        for (Feature feature : features) {
            Feature previous = map.putIfAbsent(feature.getCategory(), feature);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate category " + feature.getCategory()
                        + ": " + previous.getName() + " and " + feature.getName());
            }
        }
        return map.isEmpty() ? EMPTY : new FeatureSet(map);
    }

    public Optional<Feature> get(FeatureCategory category) {
        return Optional.ofNullable(byCategory.get(category));
    }

    public boolean contains(FeatureCategory category) {
        return byCategory.containsKey(category);
    }

    public int size() {
        return byCategory.size();
    }

    public boolean isEmpty() {
        return byCategory.isEmpty();
    }

    public List<Feature> asList() {
        return List.copyOf(byCategory.values());
    }

    public Set<FeatureCategory> categories() {
        return byCategory.keySet();
    }

    /**
     * Category-keyed overlay: features of {@code other} replace ours in the same category,
     * all remaining features of both sides are kept. Replaced categories keep their position.
     */
    public FeatureSet overlay(FeatureSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        LinkedHashMap<FeatureCategory, Feature> map = new LinkedHashMap<>(byCategory);
        map.putAll(other.byCategory);
        return new FeatureSet(map);
    }

    /**
     * Flattens to the {@code category -> name} map handed to a lexicon.
     * Wildcard features are left out so their category stays unconstrained.
     */
    public Map<FeatureCategory, String> toLookupMap() {
        Map<FeatureCategory, String> map = new EnumMap<>(FeatureCategory.class);
        for (Feature feature : byCategory.values()) {
            if (!feature.isWildcard()) {
                map.put(feature.getCategory(), feature.getName());
            }
        }
        return map;
    }

    @Override
    public String toString() {
        return byCategory.values().stream()
                .map(Feature::getName)
                .collect(Collectors.joining(":", "{", "}"));
    }
}
