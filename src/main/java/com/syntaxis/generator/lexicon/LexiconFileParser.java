package com.syntaxis.generator.lexicon;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.mapping.LexicalMapper;
import com.syntaxis.generator.model.LexicalType;
import com.syntaxis.generator.parser.FeatureLists;

/**
 * Parser for lexicon files.
 *
 * Format, one word per line:
 * <pre>
 *   type | lemma | translation, translation | features=form; features=form
 *   noun | άνθρωπος | person, human | nom:masc:sg=άνθρωπος; gen:masc:sg=ανθρώπου
 *   adverb | πολύ | very
 *   # comment
 * </pre>
 * Types and features accept the same abbreviations as templates. Translations and
 * forms are optional; a word without forms is looked up by its lemma alone.
 */
public class LexiconFileParser {
    private static final Logger log = LoggerFactory.getLogger(LexiconFileParser.class);

    private static final String FIELD_SEPARATOR = "\\|";
    private static final String FORM_SEPARATOR = ";";

    public LexiconDocument parse(Path lexiconFile) throws IOException {
        List<String> lines = Files.readAllLines(lexiconFile, StandardCharsets.UTF_8);
        return parse(lines);
    }

    public LexiconDocument parse(List<String> lines) {
        LexiconDocument doc = new LexiconDocument();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            try {
                LexicalWord word = parseLine(trimmed);
                doc.addWord(word);
                if (word.getForms().isEmpty() && !word.getLexicalType().isInvariable()) {
                    doc.addWarning("Line " + lineNum + ": " + word.getLexicalType() + " '" + word.getLemma()
                            + "' has no forms and only matches unconstrained lookups");
                }
                log.debug("Parsed lexicon entry: {} '{}' with {} forms",
                        word.getLexicalType(), word.getLemma(), word.getForms().size());
            } catch (TemplateParseException | IllegalArgumentException e) {
                doc.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse lexicon line {}: {}", lineNum, e.getMessage());
            }
        }

        return doc;
    }

    private LexicalWord parseLine(String line) {
        String[] fields = line.split(FIELD_SEPARATOR, -1);
        if (fields.length < 2 || fields.length > 4) {
            throw new IllegalArgumentException("Expected 'type | lemma [| translations [| forms]]' but got: " + line);
        }

        LexicalType lexicalType = LexicalMapper.resolve(fields[0].strip());
        String lemma = fields[1].strip();
        if (lemma.isEmpty()) {
            throw new IllegalArgumentException("Missing lemma");
        }

        LexicalWord.LexicalWordBuilder builder = LexicalWord.builder()
                .lexicalType(lexicalType)
                .lemma(lemma);

        if (fields.length > 2) {
            Arrays.stream(fields[2].split(","))
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .forEach(builder::translation);
        }

        if (fields.length > 3) {
            for (String form : fields[3].split(FORM_SEPARATOR)) {
                if (!form.isBlank()) {
                    builder.form(parseForm(form.strip(), lemma));
                }
            }
        }

        return builder.build();
    }

    private WordForm parseForm(String form, String lemma) {
        int eq = form.indexOf('=');
        if (eq < 0) {
            throw new IllegalArgumentException("Invalid form '" + form + "', expected features=text");
        }

        String text = form.substring(eq + 1).strip();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Form '" + form + "' has no text");
        }

        return WordForm.of(FeatureLists.parse(form.substring(0, eq), "form of " + lemma).toLookupMap(), text);
    }
}
