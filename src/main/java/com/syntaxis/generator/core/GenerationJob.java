package com.syntaxis.generator.core;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntaxis.generator.exception.GenerationException;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.lexicon.InMemoryLexicon;
import com.syntaxis.generator.lexicon.LexiconDocument;
import com.syntaxis.generator.lexicon.LexiconLoader;
import com.syntaxis.generator.model.TemplateAst;
import com.syntaxis.generator.parser.TemplateParsers;
import com.syntaxis.generator.resolver.FeatureResolver;

/**
 * Runs one configured generation: validate the template, load the lexicon,
 * then generate the requested number of sentences. Each sentence parses its own AST.
 */
public class GenerationJob {
    private static final Logger log = LoggerFactory.getLogger(GenerationJob.class);

    private final GeneratorConfig config;
    private final LexiconLoader lexiconLoader;
    private final TemplateParsers parsers = new TemplateParsers();

    public GenerationJob(GeneratorConfig config) {
        this(config, new LexiconLoader());
    }

    public GenerationJob(GeneratorConfig config, LexiconLoader lexiconLoader) {
        this.config = config;
        this.lexiconLoader = lexiconLoader;
    }

    public GenerationJobResult run() {
        TemplateAst ast;
        try {
            ast = parsers.parse(config.getTemplate());
        } catch (TemplateParseException e) {
            log.debug("Template rejected ({})", e.getKind());
            return GenerationJobResult.failure(JobStatus.PARSE_ERROR, e.getKind() + ": " + e.getMessage());
        }

        log.info("Parsed {} syntax template: {} groups, {} tokens",
                ast.getSyntaxVersion(), ast.getGroups().size(), ast.getTokenCount());

        if (config.isParseOnly()) {
            return GenerationJobResult.builder()
                    .status(JobStatus.SUCCESS)
                    .ast(ast)
                    .build();
        }

        LexiconDocument document;
        try {
            document = lexiconLoader.load(config.getLexiconFiles(), config.isIncludeArticles(),
                    config.isIncludePronouns());
        } catch (IOException e) {
            log.error("Failed to load lexicon", e);
            return GenerationJobResult.failure(JobStatus.INVALID_INPUT, "Failed to load lexicon: " + e.getMessage());
        }

        document.getErrors().forEach(error -> log.warn("Lexicon error: {}", error));
        document.getWarnings().forEach(warning -> log.warn("Lexicon warning: {}", warning));

        Random random = config.getSeed() != null ? new Random(config.getSeed()) : new Random();
        InMemoryLexicon lexicon = InMemoryLexicon.of(document.getWords(), random);
        TemplateGenerator generator = new TemplateGenerator(lexicon, parsers, new FeatureResolver());

        List<GenerationResult> results = new ArrayList<>();
        try {
            for (int i = 0; i < config.getCount(); i++) {
                results.add(generator.generateDetailed(config.getTemplate()));
            }
        } catch (GenerationException e) {
            return GenerationJobResult.failure(JobStatus.GENERATION_ERROR, e.getMessage());
        }

        return GenerationJobResult.builder()
                .status(JobStatus.SUCCESS)
                .ast(ast)
                .results(results)
                .wordsLoaded(lexicon.size())
                .lexiconErrors(document.getErrors().size())
                .lexiconWarnings(document.getWarnings().size())
                .build();
    }
}
