package com.syntaxis.generator.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntaxis.generator.exception.GenerationException;
import com.syntaxis.generator.lexicon.LexicalWord;
import com.syntaxis.generator.lexicon.LexiconStore;
import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.TemplateAst;
import com.syntaxis.generator.parser.TemplateParsers;
import com.syntaxis.generator.resolver.FeatureResolver;
import com.syntaxis.generator.resolver.Resolution;
import com.syntaxis.generator.resolver.ResolvedToken;

/**
 * Generates word sequences from templates.
 *
 * Every call parses its own AST, resolves features and looks up one word per token.
 * Holds no per-call state, so one instance may serve concurrent callers if the
 * lexicon allows concurrent reads.
 *
 * <pre>
 *   TemplateGenerator generator = new TemplateGenerator(lexicon);
 *   List&lt;LexicalWord&gt; words = generator.generate("(article noun)@{nom:masc:sg} (verb)@{pres:act:ter:sg}");
 * </pre>
 */
public class TemplateGenerator {
    private static final Logger log = LoggerFactory.getLogger(TemplateGenerator.class);

    private final LexiconStore lexicon;
    private final TemplateParsers parsers;
    private final FeatureResolver resolver;

    public TemplateGenerator(LexiconStore lexicon) {
        this(lexicon, new TemplateParsers(), new FeatureResolver());
    }

    public TemplateGenerator(LexiconStore lexicon, TemplateParsers parsers, FeatureResolver resolver) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.parsers = Objects.requireNonNull(parsers, "parsers");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Parses the template without touching the lexicon.
     *
     * @throws com.syntaxis.generator.exception.TemplateParseException if the template is malformed
     */
    public TemplateAst parse(String template) {
        return parsers.parse(template);
    }

    /**
     * @return one word per token, in template order
     * @throws com.syntaxis.generator.exception.TemplateParseException if the template is malformed
     * @throws GenerationException if some token has no matching word
     */
    public List<LexicalWord> generate(String template) {
        return generateDetailed(template).getWords();
    }

    public GenerationResult generateDetailed(String template) {
        TemplateAst ast = parsers.parse(template);
        GenerationResult result = generateFrom(ast, template);
        result.getOverrides().forEach(event -> log.debug(event.describe()));
        return result;
    }

    /**
     * Resolves and looks up an already parsed template. The first token without a match
     * aborts the whole call.
     */
    public GenerationResult generateFrom(TemplateAst ast, String template) {
        Resolution resolution = resolver.resolve(ast);

        GenerationResult.GenerationResultBuilder result = GenerationResult.builder()
                .template(template)
                .ast(ast)
                .tokens(resolution.getTokens())
                .overrides(resolution.getOverrides());

        for (ResolvedToken token : resolution.getTokens()) {
            Map<FeatureCategory, String> lookup = token.getLookupFeatures();
            LexicalWord word = lexicon.getRandomWord(token.getLexicalType(), lookup)
                    .orElseThrow(() -> GenerationException.noMatchingWord(token.getLexicalType(), lookup));

            log.debug("Token {} ({}) -> '{}'", token.getPosition(), token.getLexicalType(), word.getLemma());
            result.word(word.withAppliedFeatures(lookup));
        }

        return result.build();
    }
}
