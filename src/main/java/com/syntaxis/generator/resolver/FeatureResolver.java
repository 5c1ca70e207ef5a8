package com.syntaxis.generator.resolver;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntaxis.generator.model.FeatureSet;
import com.syntaxis.generator.model.TemplateAst;
import com.syntaxis.generator.model.TemplateGroup;
import com.syntaxis.generator.model.TemplateToken;

/**
 * Computes the final feature set of every token in a template.
 *
 * Group features are inherited through {@code $N} references, then each token's inline
 * features are merged on top. The AST must have passed reference validation, which
 * guarantees every chain ends.
 */
public class FeatureResolver {
    private static final Logger log = LoggerFactory.getLogger(FeatureResolver.class);

    /**
     * Features of {@code group} after following its reference chain. The group's own
     * features are overlaid on the inherited ones.
     */
    public FeatureSet resolveGroupFeatures(TemplateAst ast, TemplateGroup group) {
        if (!group.isReferencing()) {
            return group.getGroupFeatures();
        }

        TemplateGroup referenced = ast.findGroup(group.getReferences())
                .orElseThrow(() -> new IllegalStateException("Group " + group.getReferenceId()
                        + " references missing group " + group.getReferences()));

        FeatureSet inherited = resolveGroupFeatures(ast, referenced);
        return inherited.overlay(group.getGroupFeatures());
    }

    public Resolution resolve(TemplateAst ast) {
        List<ResolvedToken> tokens = new ArrayList<>();
        List<OverrideEvent> overrides = new ArrayList<>();
        int position = 0;

        for (TemplateGroup group : ast.getGroups()) {
            FeatureSet groupFeatures = resolveGroupFeatures(ast, group);

            for (TemplateToken token : group.getTokens()) {
                MergeResult merge = FeatureMerger.merge(groupFeatures, token.getDirectFeatures(),
                        token, group.getReferenceId());
                overrides.addAll(merge.getOverrides());

                tokens.add(ResolvedToken.builder()
                        .lexicalType(token.getLexicalType())
                        .features(merge.getMerged())
                        .groupId(group.getReferenceId())
                        .position(position++)
                        .build());
            }
        }

        log.debug("Resolved {} tokens with {} overrides", tokens.size(), overrides.size());
        return new Resolution(List.copyOf(tokens), List.copyOf(overrides));
    }
}
