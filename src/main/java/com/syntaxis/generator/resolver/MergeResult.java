package com.syntaxis.generator.resolver;

import java.util.List;

import com.syntaxis.generator.model.FeatureSet;

import lombok.NonNull;
import lombok.Value;

@Value
public class MergeResult {

    @NonNull
    FeatureSet merged;

    @NonNull
    List<OverrideEvent> overrides;

    public boolean hasOverrides() {
        return !overrides.isEmpty();
    }
}
