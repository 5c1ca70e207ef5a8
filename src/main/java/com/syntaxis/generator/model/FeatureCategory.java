package com.syntaxis.generator.model;

import lombok.Getter;

/**
 * Grammatical dimension a feature value belongs to.
 */
@Getter
public enum FeatureCategory {
    CASE("case"),
    GENDER("gender"),
    NUMBER("number"),
    TENSE("tense"),
    VOICE("voice"),
    MOOD("mood"),
    PERSON("person"),
    TYPE("type");

    private final String name;

    FeatureCategory(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
