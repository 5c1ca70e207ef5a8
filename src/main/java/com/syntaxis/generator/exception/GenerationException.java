package com.syntaxis.generator.exception;

import java.util.Map;

import com.syntaxis.generator.model.FeatureCategory;
import com.syntaxis.generator.model.LexicalType;

/**
 * A well-formed template the lexicon cannot currently satisfy.
 */
public class GenerationException extends SyntaxisException {

    private static final long serialVersionUID = 1L;

    private final LexicalType lexicalType;
    private final Map<FeatureCategory, String> requestedFeatures;

    private GenerationException(String message, LexicalType lexicalType,
                                Map<FeatureCategory, String> requestedFeatures) {
        super(message);
        this.lexicalType = lexicalType;
        this.requestedFeatures = Map.copyOf(requestedFeatures);
    }

    public static GenerationException noMatchingWord(LexicalType lexicalType,
                                                     Map<FeatureCategory, String> requestedFeatures) {
        return new GenerationException(
                "No " + lexicalType + " in the lexicon matches features " + requestedFeatures,
                lexicalType, requestedFeatures);
    }

    public LexicalType getLexicalType() {
        return lexicalType;
    }

    public Map<FeatureCategory, String> getRequestedFeatures() {
        return requestedFeatures;
    }
}
