package com.syntaxis.generator.resolver;

import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.TemplateToken;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A token's inline feature replaced the value its group supplied for the same category.
 *
 * Advisory only; generation continues with the inline value.
 */
@Value
@Builder
public class OverrideEvent {

    @NonNull
    FeatureCategory category;

    @NonNull
    String oldValue;

    @NonNull
    String newValue;

    TemplateToken token;

    /** Group the token belongs to, 0 when merged outside a template. */
    int groupId;

    public String describe() {
        return "Token '" + (token != null ? token.getLexicalType() : "?") + "' in group " + groupId
                + " overrides feature '" + category + "': '" + oldValue + "' -> '" + newValue + "'";
    }
}
