package com.syntaxis.generator.mapping;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.syntaxis.generator.exception.ParseErrorKind;
import com.syntaxis.generator.exception.TemplateParseException;
import com.syntaxis.generator.model.LexicalType;

import lombok.experimental.UtilityClass;

/**
 * Resolves word-class tokens such as {@code adj} or {@code prep} to a {@link LexicalType}.
 */
@UtilityClass
public class LexicalMapper {

    private static final PrefixIndex<LexicalType> INDEX = new PrefixIndex<>(
            Arrays.stream(LexicalType.values())
                    .collect(Collectors.toMap(LexicalType::getName, Function.identity())));

    public static PrefixMatch<LexicalType> lookup(String token) {
        return INDEX.lookup(token == null ? "" : token.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @throws TemplateParseException {@code UNKNOWN_LEXICAL_TYPE} or {@code AMBIGUOUS_LEXICAL_TYPE}
     */
    public static LexicalType resolve(String token) {
        PrefixMatch<LexicalType> match = lookup(token);
        return switch (match.getKind()) {
            case EXACT, UNIQUE -> match.getValue();
            case AMBIGUOUS -> throw new TemplateParseException(ParseErrorKind.AMBIGUOUS_LEXICAL_TYPE,
                    "Ambiguous lexical type: " + token + ". Conflicts with " + String.join(" ", match.getCandidates()) + ".",
                    match.getCandidates());
            case NOT_FOUND -> throw new TemplateParseException(ParseErrorKind.UNKNOWN_LEXICAL_TYPE,
                    "Unknown lexical type: " + token + ". Valid options: " + INDEX.keys());
        };
    }

    public static Set<String> knownLexicalTypes() {
        return INDEX.keys();
    }
}
