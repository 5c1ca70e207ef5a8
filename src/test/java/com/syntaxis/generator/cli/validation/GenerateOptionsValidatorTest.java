package com.syntaxis.generator.cli.validation;

import com.syntaxis.generator.cli.exception.OptionsValidationException;
import com.syntaxis.generator.cli.model.GenerateOptions;
import com.syntaxis.generator.cli.model.ValidatedGenerateOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GenerateOptionsValidator.
 */
class GenerateOptionsValidatorTest {

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @TempDir
    Path tempDir;

    @Test
    void testValidOptions() throws IOException {
        Path lexicon = Files.writeString(tempDir.resolve("words.lex"), "adverb | πολύ | very\n");

        ValidatedGenerateOptions validated = validator.validate(
                options("--lexicon", lexicon.toString(), "--count", "3", "  [adv]  "));

        assertThat(validated.getTemplate()).isEqualTo("[adv]");
        assertThat(validated.getLexiconFiles()).containsExactly(lexicon.toAbsolutePath().normalize());
    }

    @Test
    void testSeedArticlesAloneIsEnough() {
        assertThatCode(() -> validator.validate(options("--seed-articles", "[article:nom:masc:sg]")))
                .doesNotThrowAnyException();
    }

    @Test
    void testSeedPronounsAloneIsEnough() {
        assertThatCode(() -> validator.validate(options("--seed-pronouns", "[pronoun:nom:pri:sg]")))
                .doesNotThrowAnyException();
    }

    @Test
    void testParseOnlyNeedsNoLexicon() {
        ValidatedGenerateOptions validated = validator.validate(options("--parse-only", "(noun)@{nom}"));

        assertThat(validated.getLexiconFiles()).isEmpty();
    }

    @Test
    void testMissingTemplate() {
        assertThatThrownBy(() -> validator.validate(options("--seed-articles")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("A template is required");
    }

    @Test
    void testCountOutOfRange() {
        assertThatThrownBy(() -> validator.validate(options("--seed-articles", "--count", "0", "[adv]")))
                .hasMessageContaining("Count must be in range 1-1000. Got: 0");
        assertThatThrownBy(() -> validator.validate(options("--seed-articles", "-c", "1001", "[adv]")))
                .hasMessageContaining("Got: 1001");
    }

    @Test
    void testMissingLexiconFile() {
        Path missing = tempDir.resolve("missing.lex");

        assertThatThrownBy(() -> validator.validate(options("-l", missing.toString(), "[adv]")))
                .hasMessageContaining("Lexicon file does not exist or is not a file: " + missing);
    }

    @Test
    void testDirectoryIsNotALexiconFile() {
        assertThatThrownBy(() -> validator.validate(options("-l", tempDir.toString(), "[adv]")))
                .hasMessageContaining("is not a file");
    }

    @Test
    void testNoLexiconSource() {
        assertThatThrownBy(() -> validator.validate(options("[adv]")))
                .hasMessageContaining("--seed-articles or --seed-pronouns is required");
    }

    @Test
    void testAllErrorsReportedTogether() {
        OptionsValidationException e = catchThrowableOfType(
                () -> validator.validate(options("--count", "5000")), OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(3);
    }

    private static GenerateOptions options(String... args) {
        GenerateOptions options = new GenerateOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
