package com.syntaxis.generator.resolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.syntaxis.generator.model.Feature;
import com.syntaxis.generator.model.FeatureSet;
import com.syntaxis.generator.model.TemplateToken;

import lombok.experimental.UtilityClass;

/**
 * Pure feature merging. Reports overrides instead of logging them, so callers decide
 * whether to surface them.
 */
@UtilityClass
public class FeatureMerger {

    /**
     * Merges {@code overrides} onto {@code base}, category-keyed; {@code overrides} always win.
     * One {@link OverrideEvent} is produced per base category the overrides replace,
     * including a replacement by the same value.
     *
     * @param token   token the overrides belong to, recorded on the events
     * @param groupId group of the token, recorded on the events
     */
    public static MergeResult merge(FeatureSet base, FeatureSet overrides, TemplateToken token, int groupId) {
        List<OverrideEvent> events = new ArrayList<>();

        for (Feature override : overrides.asList()) {
            Optional<Feature> existing = base.get(override.getCategory());
            if (existing.isPresent()) {
                events.add(OverrideEvent.builder()
                        .category(override.getCategory())
                        .oldValue(existing.get().getName())
                        .newValue(override.getName())
                        .token(token)
                        .groupId(groupId)
                        .build());
            }
        }

        return new MergeResult(base.overlay(overrides), List.copyOf(events));
    }

    public static MergeResult merge(FeatureSet base, FeatureSet overrides) {
        return merge(base, overrides, null, 0);
    }
}
