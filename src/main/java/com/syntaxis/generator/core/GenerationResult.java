package com.syntaxis.generator.core;

import java.util.List;
import java.util.stream.Collectors;

import com.syntaxis.generator.lexicon.LexicalWord;
import com.syntaxis.generator.model.TemplateAst;
import com.syntaxis.generator.resolver.OverrideEvent;
import com.syntaxis.generator.resolver.ResolvedToken;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one successful generation.
 */
@Value
@Builder
public class GenerationResult {

    String template;

    @NonNull
    TemplateAst ast;

    /** Tokens in template order with their final features. */
    @Singular
    List<ResolvedToken> tokens;

    /** Inline features that replaced group values. Advisory. */
    @Singular
    List<OverrideEvent> overrides;

    /** One word per token, in template order. */
    @Singular
    List<LexicalWord> words;

    public String getSentence() {
        return words.stream().map(LexicalWord::toString).collect(Collectors.joining(" "));
    }
}
