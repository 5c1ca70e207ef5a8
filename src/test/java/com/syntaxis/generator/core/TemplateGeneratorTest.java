package com.syntaxis.generator.core;

import com.syntaxis.generator.exception.GenerationException;
import com.syntaxis.generator.exception.ParseErrorKind;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.lexicon.InMemoryLexicon;
import com.syntaxis.generator.lexicon.LexicalWord;
import com.syntaxis.generator.lexicon.LexiconStore;
import com.syntaxis.generator.lexicon.WordForm;
import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.LexicalType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TemplateGenerator.
 */
class TemplateGeneratorTest {

    private static final LexicalWord ARTICLE = LexicalWord.builder()
            .lemma("ο")
            .lexicalType(LexicalType.ARTICLE)
            .form(form("nom", "masc", "sg", "ο"))
            .form(form("nom", "fem", "sg", "η"))
            .form(form("acc", "masc", "sg", "τον"))
            .build();

    private static final LexicalWord NOUN = LexicalWord.builder()
            .lemma("άνθρωπος")
            .lexicalType(LexicalType.NOUN)
            .translation("person")
            .form(form("nom", "masc", "sg", "άνθρωπος"))
            .form(form("acc", "masc", "sg", "άνθρωπο"))
            .build();

    private static final LexicalWord VERB = LexicalWord.builder()
            .lemma("γράφω")
            .lexicalType(LexicalType.VERB)
            .form(WordForm.of(Map.of(
                    FeatureCategory.TENSE, "present",
                    FeatureCategory.VOICE, "active",
                    FeatureCategory.PERSON, "ter",
                    FeatureCategory.NUMBER, "sg"), "γράφει"))
            .build();

    private final TemplateGenerator generator =
            new TemplateGenerator(InMemoryLexicon.of(List.of(ARTICLE, NOUN, VERB), new Random(3)));

    @Test
    void testGenerateBracketTemplate() {
        List<LexicalWord> words = generator.generate("[article:nom:masc:sg] [noun:nom:masc:sg]");

        assertThat(words).extracting(LexicalWord::getLemma).containsExactly("ο", "άνθρωπος");
        assertThat(words).extracting(LexicalWord::toString).containsExactly("ο", "άνθρωπος");
    }

    @Test
    void testGenerateGroupingTemplateWithReference() {
        GenerationResult result = generator.generateDetailed(
                "(article noun)@{nom:masc:sg} (verb)@{pres:act:ter:sg} (article noun{acc})@$1");

        assertThat(result.getWords()).hasSize(5);
        assertThat(result.getSentence()).isEqualTo("ο άνθρωπος γράφει ο άνθρωπο");
        assertThat(result.getOverrides()).singleElement()
                .satisfies(event -> assertThat(event.getCategory()).isEqualTo(FeatureCategory.CASE));
    }

    @Test
    void testWordsCarryTheirLookupFeatures() {
        GenerationResult result = generator.generateDetailed("(article noun)@{acc:masc:sg}");

        assertThat(result.getWords().get(0).getAppliedFeatures()).isEqualTo(Map.of(
                FeatureCategory.CASE, "acc",
                FeatureCategory.GENDER, "masc",
                FeatureCategory.NUMBER, "sg"));
        assertThat(result.getSentence()).isEqualTo("τον άνθρωπο");
        assertThat(result.getTokens()).hasSize(2);
        assertThat(result.getTemplate()).isEqualTo("(article noun)@{acc:masc:sg}");
    }

    @Test
    void testNoMatchingWordAbortsGeneration() {
        TemplateGenerator empty = new TemplateGenerator(new InMemoryLexicon());

        GenerationException e = catchThrowableOfType(() -> empty.generate("[article:nom:masc:sg]"),
                GenerationException.class);

        assertThat(e.getLexicalType()).isEqualTo(LexicalType.ARTICLE);
        assertThat(e.getRequestedFeatures()).isEqualTo(Map.of(
                FeatureCategory.CASE, "nom",
                FeatureCategory.GENDER, "masc",
                FeatureCategory.NUMBER, "sg"));
        assertThat(e).hasMessage("No article in the lexicon matches features {case=nom, gender=masc, number=sg}");
    }

    @Test
    void testLaterTokenWithoutMatchFailsWholeCall() {
        assertThatThrownBy(() -> generator.generate("[article:nom:masc:sg] [noun:nom:fem:sg]"))
                .isInstanceOf(GenerationException.class)
                .hasMessageStartingWith("No noun");
    }

    @Test
    void testParseErrorsNeverReachTheLexicon() {
        LexiconStore failing = (type, features) -> {
            throw new AssertionError("lexicon must not be consulted");
        };
        TemplateGenerator strict = new TemplateGenerator(failing);

        TemplateParseException e = catchThrowableOfType(
                () -> strict.generate("[article:nom:masc:sg] [noun:nom:masc]"), TemplateParseException.class);

        assertThat(e.getKind()).isEqualTo(ParseErrorKind.WRONG_FEATURE_ARITY);
    }

    @Test
    void testParseOnly() {
        assertThat(generator.parse("(article noun)@{nom:masc:sg}").getTokenCount()).isEqualTo(2);
    }

    private static WordForm form(String grammaticalCase, String gender, String number, String text) {
        return WordForm.of(Map.of(
                FeatureCategory.CASE, grammaticalCase,
                FeatureCategory.GENDER, gender,
                FeatureCategory.NUMBER, number), text);
    }
}
