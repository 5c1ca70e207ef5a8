package com.syntaxis.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single word request inside a group.
 */
@Value
@Builder(toBuilder = true)
public class TemplateToken {

    @NonNull
    LexicalType lexicalType;

    /**
     * Features written inline on this token only; they win over group features.
     */
    @NonNull
    @Builder.Default
    FeatureSet directFeatures = FeatureSet.empty();

    @Override
    public String toString() {
        return directFeatures.isEmpty() ? lexicalType.getName() : lexicalType.getName() + directFeatures;
    }
}
