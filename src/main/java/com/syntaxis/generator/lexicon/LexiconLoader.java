package com.syntaxis.generator.lexicon;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads lexicon files and bundled seed resources into one {@link LexiconDocument}.
 */
public class LexiconLoader {
    private static final Logger log = LoggerFactory.getLogger(LexiconLoader.class);

    /** Definite and indefinite Modern Greek articles. */
    public static final String ARTICLES_RESOURCE = "lexicon/articles.lex";

    /** Personal, demonstrative, interrogative, possessive, indefinite and relative pronouns. */
    public static final String PRONOUNS_RESOURCE = "lexicon/pronouns.lex";

    private final LexiconFileParser parser;

    public LexiconLoader() {
        this(new LexiconFileParser());
    }

    public LexiconLoader(LexiconFileParser parser) {
        this.parser = parser;
    }

    public LexiconDocument load(List<Path> files, boolean includeArticles) throws IOException {
        return load(files, includeArticles, false);
    }

    /**
     * Loads the requested seeds first, then each file in order.
     */
    public LexiconDocument load(List<Path> files, boolean includeArticles, boolean includePronouns) throws IOException {
        LexiconDocument combined = new LexiconDocument();

        if (includeArticles) {
            combined.merge(ARTICLES_RESOURCE, loadResource(ARTICLES_RESOURCE));
        }
        if (includePronouns) {
            combined.merge(PRONOUNS_RESOURCE, loadResource(PRONOUNS_RESOURCE));
        }

        for (Path file : files) {
            log.info("Loading lexicon: {}", file);
            LexiconDocument doc = parser.parse(file);
            log.info("Loaded {} words from {} ({} errors)", doc.getWords().size(), file.getFileName(), doc.getErrors().size());
            combined.merge(file.toString(), doc);
        }

        return combined;
    }

    public LexiconDocument loadResource(String resource) throws IOException {
        ClassLoader classLoader = LexiconLoader.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileNotFoundException("Lexicon resource not found on classpath: " + resource);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return parser.parse(reader.lines().toList());
            }
        }
    }
}
