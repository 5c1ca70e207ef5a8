package com.syntaxis.generator.core;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for one command-line generation run.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Template to parse and generate from.
     */
    private String template;

    /**
     * Lexicon files to load, in order.
     */
    @Builder.Default
    private List<Path> lexiconFiles = List.of();

    /**
     * Whether to load the bundled article seed before the files.
     */
    private boolean includeArticles;

    /**
     * Whether to load the bundled pronoun seed before the files.
     */
    private boolean includePronouns;

    /**
     * Number of sentences to generate from the template.
     */
    @Builder.Default
    private int count = 1;

    /**
     * Random seed for word selection; null for a fresh seed on every run.
     */
    private Long seed;

    /**
     * Only parse the template and report its structure; no lexicon is loaded.
     */
    private boolean parseOnly;
}
