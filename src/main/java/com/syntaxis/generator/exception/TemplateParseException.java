package com.syntaxis.generator.exception;

import java.util.List;

/**
 * A malformed template. Fixable by the caller, raised before any lexicon lookup.
 */
public class TemplateParseException extends SyntaxisException {

    private static final long serialVersionUID = 1L;

    private final ParseErrorKind kind;
    private final List<String> candidates;

    public TemplateParseException(ParseErrorKind kind, String message) {
        this(kind, message, List.of());
    }

    public TemplateParseException(ParseErrorKind kind, String message, List<String> candidates) {
        super(message);
        this.kind = kind;
        this.candidates = List.copyOf(candidates);
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * Conflicting vocabulary entries for the ambiguity kinds, empty otherwise.
     */
    public List<String> getCandidates() {
        return candidates;
    }
}
