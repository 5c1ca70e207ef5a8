package com.syntaxis.generator.lexicon;

import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.LexicalType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LexiconFileParser.
 */
class LexiconFileParserTest {

    private final LexiconFileParser parser = new LexiconFileParser();

    @TempDir
    Path tempDir;

    @Test
    void testParseNounWithForms() {
        List<String> lines = List.of("noun | άνθρωπος | person, human | nom:masc:sg=άνθρωπος; gen:masc:sg=ανθρώπου");

        LexiconDocument doc = parser.parse(lines);

        assertThat(doc.hasErrors()).isFalse();
        assertThat(doc.getWords()).hasSize(1);

        LexicalWord word = doc.getWords().get(0);
        assertThat(word.getLexicalType()).isEqualTo(LexicalType.NOUN);
        assertThat(word.getLemma()).isEqualTo("άνθρωπος");
        assertThat(word.getTranslations()).containsExactly("person", "human");
        assertThat(word.getForms()).hasSize(2);
        assertThat(word.getForms().get(1).getText()).isEqualTo("ανθρώπου");
        assertThat(word.getForms().get(1).getFeatures()).isEqualTo(Map.of(
                FeatureCategory.CASE, "gen",
                FeatureCategory.GENDER, "masc",
                FeatureCategory.NUMBER, "sg"));
    }

    @Test
    void testAbbreviationsInTypesAndFeatures() {
        LexiconDocument doc = parser.parse(List.of("adj | καλός | good | nom:m:sg=καλός; nom:f:sg=καλή"));

        LexicalWord word = doc.getWords().get(0);
        assertThat(word.getLexicalType()).isEqualTo(LexicalType.ADJECTIVE);
        assertThat(word.getForms().get(1).getFeatures()).containsEntry(FeatureCategory.GENDER, "fem");
    }

    @Test
    void testCommentsAndBlankLinesAreSkipped() {
        LexiconDocument doc = parser.parse(List.of(
                "# nouns",
                "",
                "   ",
                "adverb | πολύ | very"));

        assertThat(doc.getWords()).hasSize(1);
        assertThat(doc.getErrors()).isEmpty();
        assertThat(doc.getWarnings()).isEmpty();
    }

    @Test
    void testErrorsCarryLineNumbers() {
        LexiconDocument doc = parser.parse(List.of(
                "adverb | πολύ | very",
                "noun",
                "xyz | foo",
                "noun | σπίτι | house | nom:neut:sg",
                "noun |  | house"));

        assertThat(doc.getWords()).hasSize(1);
        assertThat(doc.getErrors()).hasSize(4);
        assertThat(doc.getErrors().get(0)).startsWith("Line 2: ");
        assertThat(doc.getErrors().get(1)).startsWith("Line 3: Unknown lexical type: xyz");
        assertThat(doc.getErrors().get(2)).startsWith("Line 4: ").contains("expected features=text");
        assertThat(doc.getErrors().get(3)).isEqualTo("Line 5: Missing lemma");
    }

    @Test
    void testInvalidFeatureInForm() {
        LexiconDocument doc = parser.parse(List.of("noun | σπίτι | house | nom:nom:sg=σπίτι"));

        assertThat(doc.hasErrors()).isTrue();
        assertThat(doc.getErrors().get(0)).startsWith("Line 1: Duplicate case feature");
    }

    @Test
    void testInflectableWordWithoutFormsIsWarned() {
        LexiconDocument doc = parser.parse(List.of("noun | σπίτι | house"));

        assertThat(doc.getWords()).hasSize(1);
        assertThat(doc.getWarnings()).hasSize(1);
        assertThat(doc.getWarnings().get(0)).startsWith("Line 1: noun 'σπίτι' has no forms");
    }

    @Test
    void testParseFile() throws IOException {
        Path file = tempDir.resolve("verbs.lex");
        Files.writeString(file, """
                # verbs
                verb | γράφω | write | present:active:pri:sg=γράφω; present:active:ter:sg=γράφει
                conj | και | and
                """);

        LexiconDocument doc = parser.parse(file);

        assertThat(doc.getWords()).extracting(LexicalWord::getLemma).containsExactly("γράφω", "και");
        assertThat(doc.getWords().get(0).getForms().get(1).getFeatures())
                .containsEntry(FeatureCategory.PERSON, "ter")
                .containsEntry(FeatureCategory.TENSE, "present");
    }
}
