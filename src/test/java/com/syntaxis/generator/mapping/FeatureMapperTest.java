package com.syntaxis.generator.mapping;

import com.syntaxis.generator.exception.ParseErrorKind;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.model.Feature;
import com.syntaxis.generator.model.FeatureCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FeatureMapper.
 */
class FeatureMapperTest {

    @ParameterizedTest
    @CsvSource({
            "nom, nom, CASE",
            "NOM, nom, CASE",
            "acc, acc, CASE",
            "m, masc, GENDER",
            "f, fem, GENDER",
            "gender, gender*, GENDER",
            "pl, pl, NUMBER",
            "pres, present, TENSE",
            "aor, aorist, TENSE",
            "act, active, VOICE",
            "pass, passive, VOICE",
            "ind, ind, MOOD",
            "ter, ter, PERSON",
            "def, definite, TYPE",
            "indef, indefinite, TYPE"
    })
    void testResolveCanonicalAndAbbreviated(String token, String expectedName, FeatureCategory expectedCategory) {
        Feature feature = FeatureMapper.resolve(token);

        assertThat(feature.getName()).isEqualTo(expectedName);
        assertThat(feature.getCategory()).isEqualTo(expectedCategory);
    }

    @Test
    void testAmbiguousFeature() {
        assertThatThrownBy(() -> FeatureMapper.resolve("a"))
                .isInstanceOf(TemplateParseException.class)
                .hasMessage("Ambiguous feature: a. Conflicts with acc active aorist.")
                .satisfies(e -> {
                    TemplateParseException parseError = (TemplateParseException) e;
                    assertThat(parseError.getKind()).isEqualTo(ParseErrorKind.AMBIGUOUS_FEATURE);
                    assertThat(parseError.getCandidates()).containsExactly("acc", "active", "aorist");
                });
    }

    @Test
    void testAmbiguousGenderPrefix() {
        TemplateParseException e = catchThrowableOfType(() -> FeatureMapper.resolve("g"),
                TemplateParseException.class);

        assertThat(e.getCandidates()).containsExactly("gen", "gender*");
    }

    @Test
    void testUnknownFeature() {
        assertThatThrownBy(() -> FeatureMapper.resolve("xyz"))
                .isInstanceOf(TemplateParseException.class)
                .hasMessage("Unknown feature: xyz")
                .extracting(e -> ((TemplateParseException) e).getKind())
                .isEqualTo(ParseErrorKind.UNKNOWN_FEATURE);
    }

    @Test
    void testWildcardsResolveExactly() {
        assertThat(FeatureMapper.resolve("gender*").isWildcard()).isTrue();
        assertThat(FeatureMapper.resolve("number*").isWildcard()).isTrue();
        assertThat(FeatureMapper.resolve("person*").isWildcard()).isTrue();
        assertThat(FeatureMapper.resolve("masc").isWildcard()).isFalse();
    }

    @Test
    void testBarePersonIsAmbiguousWithPersonalTypes() {
        TemplateParseException e = catchThrowableOfType(() -> FeatureMapper.resolve("person"),
                TemplateParseException.class);

        assertThat(e.getKind()).isEqualTo(ParseErrorKind.AMBIGUOUS_FEATURE);
        assertThat(e.getCandidates()).containsExactly("person*", "personal_strong", "personal_weak");
    }

    @Test
    void testEveryKnownFeatureIsAnExactKey() {
        assertThat(FeatureMapper.knownFeatures()).hasSize(30);
        for (String value : FeatureMapper.knownFeatures()) {
            assertThat(FeatureMapper.lookup(value).getKind())
                    .as(value)
                    .isEqualTo(PrefixMatch.Kind.EXACT);
        }
    }
}
