package com.syntaxis.generator.lexicon;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.LexicalType;

/**
 * Lexicon held in memory and searched by linear scan per lexical type.
 *
 * Safe for concurrent reads and writes.
 */
public class InMemoryLexicon implements LexiconStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryLexicon.class);

    private final Map<LexicalType, List<LexicalWord>> wordsByType = new ConcurrentHashMap<>();
    private final Random random;

    public InMemoryLexicon() {
        this(new Random());
    }

    public InMemoryLexicon(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public static InMemoryLexicon of(Collection<LexicalWord> words, Random random) {
        InMemoryLexicon lexicon = new InMemoryLexicon(random);
        lexicon.addAll(words);
        return lexicon;
    }

    public void add(LexicalWord word) {
        Objects.requireNonNull(word, "word");
        wordsByType.computeIfAbsent(word.getLexicalType(), type -> new CopyOnWriteArrayList<>()).add(word);
    }

    public void addAll(Collection<LexicalWord> words) {
        words.forEach(this::add);
    }

    @Override
    public Optional<LexicalWord> getRandomWord(LexicalType lexicalType, Map<FeatureCategory, String> features) {
        List<LexicalWord> candidates = wordsByType.getOrDefault(lexicalType, List.of()).stream()
                .filter(word -> word.matches(features))
                .toList();

        if (candidates.isEmpty()) {
            log.debug("No {} matches {}", lexicalType, features);
            return Optional.empty();
        }

        LexicalWord chosen = candidates.get(random.nextInt(candidates.size()));
        log.debug("Picked {} '{}' out of {} candidates for {}", lexicalType, chosen.getLemma(), candidates.size(), features);
        return Optional.of(chosen);
    }

    public int size() {
        return wordsByType.values().stream().mapToInt(List::size).sum();
    }

    public int count(LexicalType lexicalType) {
        return wordsByType.getOrDefault(lexicalType, List.of()).size();
    }
}
