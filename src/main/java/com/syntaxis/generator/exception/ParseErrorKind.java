package com.syntaxis.generator.exception;

/**
 * Reasons a template is rejected before any lexicon access.
 */
public enum ParseErrorKind {
    EMPTY_TEMPLATE,
    NO_TOKENS_FOUND,
    UNKNOWN_LEXICAL_TYPE,
    AMBIGUOUS_LEXICAL_TYPE,
    UNKNOWN_FEATURE,
    AMBIGUOUS_FEATURE,
    WRONG_FEATURE_ARITY,
    INVALID_OR_DUPLICATE_FEATURE,
    UNEXPECTED_FEATURES,
    UNBALANCED_DELIMITERS,
    EMPTY_GROUP,
    NON_EXISTENT_REFERENCE,
    FORWARD_OR_SELF_REFERENCE,
    INVALID_TEMPLATE_LEAD_CHARACTER
}
