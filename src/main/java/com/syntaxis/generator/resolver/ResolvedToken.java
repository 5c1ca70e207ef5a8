package com.syntaxis.generator.resolver;

import java.util.Map;

import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.FeatureSet;
import com.syntaxis.generator.model.LexicalType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A token with its final feature set, ready for lexicon lookup.
 */
@Value
@Builder
public class ResolvedToken {

    @NonNull
    LexicalType lexicalType;

    /** Group features after inheritance, merged with the token's own features. */
    @NonNull
    FeatureSet features;

    int groupId;

    /** 0-based position of the token across the whole template. */
    int position;

    public Map<FeatureCategory, String> getLookupFeatures() {
        return features.toLookupMap();
    }
}
