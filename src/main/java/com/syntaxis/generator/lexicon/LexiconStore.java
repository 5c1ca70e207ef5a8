package com.syntaxis.generator.lexicon;

import java.util.Map;
import java.util.Optional;

import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.LexicalType;

/**
 * Source of words for generation.
 *
 * Implementations must tolerate concurrent reads if generators share them across threads.
 */
public interface LexiconStore {

    /**
     * Picks a word of the given type, uniformly at random among those having at least one
     * form that satisfies every {@code (category, value)} constraint.
     *
     * @param features constraints, all of which must hold; empty means any word of the type
     * @return the word, or empty when nothing matches (not an error)
     */
    Optional<LexicalWord> getRandomWord(LexicalType lexicalType, Map<FeatureCategory, String> features);
}
