package com.syntaxis.generator.lexicon;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Words read from one or more lexicon files, with the problems found on the way.
 */
@Data
public class LexiconDocument {
    private final List<LexicalWord> words = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void addWord(LexicalWord word) {
        words.add(word);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Appends another document's content, prefixing its messages with {@code source}.
     */
    public void merge(String source, LexiconDocument other) {
        words.addAll(other.getWords());
        other.getErrors().forEach(e -> errors.add(source + ": " + e));
        other.getWarnings().forEach(w -> warnings.add(source + ": " + w));
    }
}
