package com.syntaxis.generator.resolver;

import java.util.List;

import lombok.Value;

/**
 * Every token of a template with its final features, plus the overrides met on the way.
 */
@Value
public class Resolution {
    List<ResolvedToken> tokens;
    List<OverrideEvent> overrides;
}
