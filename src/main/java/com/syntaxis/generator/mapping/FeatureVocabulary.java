package com.syntaxis.generator.mapping;

import java.util.LinkedHashMap;
import java.util.Map;

import com.syntaxis.generator.model.FeatureCategory;

import lombok.experimental.UtilityClass;

/**
 * Canonical feature values understood in templates and lexicon files.
 */
@UtilityClass
public class FeatureVocabulary {

    // Case
    public static final String NOMINATIVE = "nom";
    public static final String GENITIVE = "gen";
    public static final String ACCUSATIVE = "acc";
    public static final String VOCATIVE = "voc";

    // Gender
    public static final String MASCULINE = "masc";
    public static final String FEMININE = "fem";
    public static final String NEUTER = "neut";
    public static final String GENDER_WILDCARD = "gender*";

    // Number
    public static final String SINGULAR = "sg";
    public static final String PLURAL = "pl";
    public static final String NUMBER_WILDCARD = "number*";

    // Tense
    public static final String PRESENT = "present";
    public static final String AORIST = "aorist";
    public static final String PARATATIKOS = "paratatikos";

    // Voice
    public static final String ACTIVE = "active";
    public static final String PASSIVE = "passive";

    // Mood
    public static final String INDICATIVE = "ind";
    public static final String IMPERATIVE = "imp";

    // Person
    public static final String FIRST = "pri";
    public static final String SECOND = "sec";
    public static final String THIRD = "ter";
    public static final String PERSON_WILDCARD = "person*";

    // Pronoun and article type
    public static final String PERSONAL_STRONG = "personal_strong";
    public static final String PERSONAL_WEAK = "personal_weak";
    public static final String DEMONSTRATIVE = "demonstrative";
    public static final String INTERROGATIVE = "interrogative";
    public static final String POSSESSIVE = "possessive";
    public static final String RELATIVE = "relative";
    public static final String DEFINITE = "definite";
    public static final String INDEFINITE = "indefinite";

    public static Map<String, FeatureCategory> categoriesByValue() {
        Map<String, FeatureCategory> table = new LinkedHashMap<>();
        put(table, FeatureCategory.CASE, NOMINATIVE, GENITIVE, ACCUSATIVE, VOCATIVE);
        put(table, FeatureCategory.GENDER, MASCULINE, FEMININE, NEUTER, GENDER_WILDCARD);
        put(table, FeatureCategory.NUMBER, SINGULAR, PLURAL, NUMBER_WILDCARD);
        put(table, FeatureCategory.TENSE, PRESENT, AORIST, PARATATIKOS);
        put(table, FeatureCategory.VOICE, ACTIVE, PASSIVE);
        put(table, FeatureCategory.MOOD, INDICATIVE, IMPERATIVE);
        put(table, FeatureCategory.PERSON, FIRST, SECOND, THIRD, PERSON_WILDCARD);
        put(table, FeatureCategory.TYPE, PERSONAL_STRONG, PERSONAL_WEAK, DEMONSTRATIVE, INTERROGATIVE,
                POSSESSIVE, RELATIVE, DEFINITE, INDEFINITE);
        return table;
    }

    private static void put(Map<String, FeatureCategory> table, FeatureCategory category, String... values) {
        for (String value : values) {
            FeatureCategory previous = table.put(value, category);
            if (previous != null) {
                throw new IllegalStateException("Feature value " + value + " listed under both "
                        + previous + " and " + category);
            }
        }
    }
}
