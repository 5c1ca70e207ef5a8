package com.syntaxis.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.syntaxis.generator.cli.exception.OptionsValidationException;
import com.syntaxis.generator.cli.model.GenerateOptions;
import com.syntaxis.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	public static final int MAX_COUNT = 1000;

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (isBlank(o.getTemplate())) {
			errors.add("A template is required, e.g. \"[article:nom:masc:sg] [noun:nom:masc:sg]\".");
		}

		if (o.getCount() < 1 || o.getCount() > MAX_COUNT) {
			errors.add("Count must be in range 1-" + MAX_COUNT + ". Got: " + o.getCount());
		}

		List<Path> lexiconFiles = new ArrayList<>();
		for (Path file : o.getLexiconFiles()) {
			if (!Files.isRegularFile(file)) {
				errors.add("Lexicon file does not exist or is not a file: " + file);
			} else if (!Files.isReadable(file)) {
				errors.add("Lexicon file is not readable: " + file);
			} else {
				lexiconFiles.add(file.toAbsolutePath().normalize());
			}
		}

		// Parse-only never touches the lexicon
		if (!o.isParseOnly() && o.getLexiconFiles().isEmpty() && !o.isSeedArticles() && !o.isSeedPronouns()) {
			errors.add("At least one --lexicon file, --seed-articles or --seed-pronouns is required unless --parse-only is set.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(o.getTemplate().strip(), List.copyOf(lexiconFiles));
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
