package com.syntaxis.generator.model;

import java.util.EnumSet;
import java.util.Set;

import lombok.Getter;

/**
 * Word classes a template token can request.
 *
 * Each type knows the feature shape the bracket syntax demands of it:
 * the categories that must be present and the ones that may be present.
 */
@Getter
public enum LexicalType {
    NOUN("noun", nominal(), nominal()),
    ADJECTIVE("adjective", nominal(), nominal()),
    ARTICLE("article", nominal(), nominal()),
    NUMERAL("numeral", nominal(), nominal()),
    VERB("verb",
            EnumSet.of(FeatureCategory.TENSE, FeatureCategory.VOICE, FeatureCategory.PERSON, FeatureCategory.NUMBER),
            EnumSet.of(FeatureCategory.TENSE, FeatureCategory.VOICE, FeatureCategory.PERSON, FeatureCategory.NUMBER)),
    PRONOUN("pronoun",
            EnumSet.of(FeatureCategory.CASE, FeatureCategory.PERSON, FeatureCategory.NUMBER),
            EnumSet.of(FeatureCategory.CASE, FeatureCategory.PERSON, FeatureCategory.NUMBER, FeatureCategory.GENDER)),
    ADVERB("adverb", EnumSet.noneOf(FeatureCategory.class), EnumSet.noneOf(FeatureCategory.class)),
    PREPOSITION("preposition", EnumSet.noneOf(FeatureCategory.class), EnumSet.noneOf(FeatureCategory.class)),
    CONJUNCTION("conjunction", EnumSet.noneOf(FeatureCategory.class), EnumSet.noneOf(FeatureCategory.class));

    private final String name;
    private final Set<FeatureCategory> requiredCategories;
    private final Set<FeatureCategory> allowedCategories;

    LexicalType(String name, Set<FeatureCategory> requiredCategories, Set<FeatureCategory> allowedCategories) {
        this.name = name;
        this.requiredCategories = Set.copyOf(requiredCategories);
        this.allowedCategories = Set.copyOf(allowedCategories);
    }

    /**
     * Invariable words take no inflectional features at all.
     */
    public boolean isInvariable() {
        return allowedCategories.isEmpty();
    }

    public int getMinFeatures() {
        return requiredCategories.size();
    }

    public int getMaxFeatures() {
        return allowedCategories.size();
    }

    @Override
    public String toString() {
        return name;
    }

    private static Set<FeatureCategory> nominal() {
        return EnumSet.of(FeatureCategory.CASE, FeatureCategory.GENDER, FeatureCategory.NUMBER);
    }
}
