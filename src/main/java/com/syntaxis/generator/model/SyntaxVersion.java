package com.syntaxis.generator.model;

import lombok.Getter;

/**
 * Template dialects. The lead character of a trimmed template selects one.
 */
@Getter
public enum SyntaxVersion {
    /** {@code [noun:nom:masc:sg]} */
    BRACKET(1, '['),
    /** {@code (article noun)@{nom:masc:sg}} */
    GROUPING(2, '(');

    private final int number;
    private final char leadCharacter;

    SyntaxVersion(int number, char leadCharacter) {
        this.number = number;
        this.leadCharacter = leadCharacter;
    }
}
