package com.syntaxis.generator.lexicon;

import java.util.List;
import java.util.Map;

import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.LexicalType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A dictionary entry: lemma, translations and its inflected forms.
 *
 * A word returned by generation carries the features it was requested with, so it can
 * render the matching surface form.
 */
@Value
@Builder(toBuilder = true)
public class LexicalWord {

    @NonNull
    String lemma;

    @NonNull
    LexicalType lexicalType;

    @Singular
    List<String> translations;

    /**
     * Inflected forms. A word without forms behaves as one featureless form equal to its lemma.
     */
    @Singular
    List<WordForm> forms;

    @NonNull
    @Builder.Default
    Map<FeatureCategory, String> appliedFeatures = Map.of();

    public boolean matches(Map<FeatureCategory, String> constraints) {
        return effectiveForms().stream().anyMatch(form -> form.satisfies(constraints));
    }

    public LexicalWord withAppliedFeatures(Map<FeatureCategory, String> features) {
        return toBuilder().appliedFeatures(Map.copyOf(features)).build();
    }

    /**
     * Texts of the forms matching the applied features, in declaration order.
     */
    public List<String> getSurfaceForms() {
        return effectiveForms().stream()
                .filter(form -> form.satisfies(appliedFeatures))
                .map(WordForm::getText)
                .distinct()
                .toList();
    }

    private List<WordForm> effectiveForms() {
        return forms.isEmpty() ? List.of(WordForm.invariable(lemma)) : forms;
    }

    @Override
    public String toString() {
        List<String> surface = getSurfaceForms();
        return surface.isEmpty() ? lemma : surface.get(0);
    }
}
