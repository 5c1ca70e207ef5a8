package com.syntaxis.generator.lexicon;

import java.util.Map;

import com.syntaxis.generator.model.FeatureCategory;

import lombok.NonNull;
import lombok.Value;

/**
 * One surface form of a word and the features it realises.
 */
@Value
public class WordForm {

    @NonNull
    Map<FeatureCategory, String> features;

    @NonNull
    String text;

    public static WordForm of(Map<FeatureCategory, String> features, String text) {
        return new WordForm(Map.copyOf(features), text);
    }

    public static WordForm invariable(String text) {
        return new WordForm(Map.of(), text);
    }

    public boolean satisfies(Map<FeatureCategory, String> constraints) {
        for (Map.Entry<FeatureCategory, String> constraint : constraints.entrySet()) {
            if (!constraint.getValue().equals(features.get(constraint.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
