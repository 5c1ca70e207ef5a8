package com.syntaxis.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Parameters(index = "0", arity = "0..1", paramLabel = "<template>", description = "Template in bracket syntax ([noun:nom:masc:sg]) or grouping syntax ((article noun)@{nom:masc:sg})")
	private String template;

	@Option(names = { "--lexicon", "-l" }, description = "Lexicon file to load (repeatable)")
	private List<Path> lexiconFiles = new ArrayList<>();

	@Option(names = { "--seed-articles" }, description = "Load the bundled Greek definite and indefinite articles")
	private boolean seedArticles;

	@Option(names = { "--seed-pronouns" }, description = "Load the bundled Greek personal, demonstrative and other pronouns")
	private boolean seedPronouns;

	@Option(names = { "--count", "-c" }, defaultValue = "1", description = "Number of sentences to generate (1-1000, default: 1)")
	private int count;

	@Option(names = { "--seed" }, description = "Random seed for reproducible word selection")
	private Long seed;

	@Option(names = { "--parse-only" }, description = "Parse the template and print its structure without generating")
	private boolean parseOnly;

	@Option(names = { "--show-features" }, description = "Print the resolved features of every token")
	private boolean showFeatures;

}
