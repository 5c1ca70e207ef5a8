package com.syntaxis.generator.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.syntaxis.generator.exception.ParseErrorKind;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.mapping.FeatureMapper;
import com.syntaxis.generator.model.Feature;
import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.FeatureSet;

import lombok.experimental.UtilityClass;

/**
 * Parses colon or comma separated feature lists such as {@code nom:masc:sg}.
 */
@UtilityClass
public class FeatureLists {

    private static final Pattern SEPARATOR = Pattern.compile("[,:]");

    /**
     * Resolves every entry through {@link FeatureMapper}; empty entries are skipped.
     *
     * @param context what the list belongs to, used in error messages
     * @throws TemplateParseException on unknown or ambiguous entries, or when two entries share a category
     */
    public static FeatureSet parse(String raw, String context) {
        if (raw == null || raw.isBlank()) {
            return FeatureSet.empty();
        }

        List<Feature> features = new ArrayList<>();
        Set<FeatureCategory> seen = EnumSet.noneOf(FeatureCategory.class);

        for (String entry : SEPARATOR.split(raw)) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Feature feature = FeatureMapper.resolve(trimmed);
            if (!seen.add(feature.getCategory())) {
                throw new TemplateParseException(ParseErrorKind.INVALID_OR_DUPLICATE_FEATURE,
                        "Duplicate " + feature.getCategory() + " feature for " + context + ": " + trimmed);
            }
            features.add(feature);
        }

        return FeatureSet.of(features);
    }
}
