package com.syntaxis.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One or more tokens sharing a feature set, or inheriting it from an earlier group.
 *
 * Bracket templates produce one single-token group per bracket.
 */
@Value
@Builder(toBuilder = true)
public class TemplateGroup {

    @NonNull
    @Singular
    List<TemplateToken> tokens;

    @NonNull
    @Builder.Default
    FeatureSet groupFeatures = FeatureSet.empty();

    /**
     * 1-based position of the group in parse order.
     */
    int referenceId;

    /**
     * {@code referenceId} of the earlier group this one inherits from, or null.
     */
    Integer references;

    public Optional<Integer> getReference() {
        return Optional.ofNullable(references);
    }

    public boolean isReferencing() {
        return references != null;
    }
}
