package com.syntaxis.generator.mapping;

import java.util.Locale;
import java.util.Set;

import com.syntaxis.generator.exception.ParseErrorKind;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.model.Feature;
import com.syntaxis.generator.model.FeatureCategory;

import lombok.experimental.UtilityClass;

/**
 * Resolves feature tokens, possibly abbreviated, to canonical features.
 *
 * An abbreviation is accepted as long as it is a prefix of exactly one known value.
 * Growing the vocabulary can therefore make a previously valid abbreviation ambiguous.
 */
@UtilityClass
public class FeatureMapper {

    private static final PrefixIndex<FeatureCategory> INDEX = new PrefixIndex<>(FeatureVocabulary.categoriesByValue());

    public static PrefixMatch<FeatureCategory> lookup(String token) {
        return INDEX.lookup(normalize(token));
    }

    /**
     * @throws TemplateParseException {@code UNKNOWN_FEATURE} or {@code AMBIGUOUS_FEATURE}
     */
    public static Feature resolve(String token) {
        PrefixMatch<FeatureCategory> match = lookup(token);
        return switch (match.getKind()) {
            case EXACT, UNIQUE -> Feature.of(match.getKey(), match.getValue());
            case AMBIGUOUS -> throw new TemplateParseException(ParseErrorKind.AMBIGUOUS_FEATURE,
                    "Ambiguous feature: " + token + ". Conflicts with " + String.join(" ", match.getCandidates()) + ".",
                    match.getCandidates());
            case NOT_FOUND -> throw new TemplateParseException(ParseErrorKind.UNKNOWN_FEATURE,
                    "Unknown feature: " + token);
        };
    }

    public static Set<String> knownFeatures() {
        return INDEX.keys();
    }

    private static String normalize(String token) {
        return token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
    }
}
