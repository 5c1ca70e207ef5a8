package com.syntaxis.generator.exception;

/**
 * Base class for every error raised while turning a template into words.
 */
public abstract class SyntaxisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected SyntaxisException(String message) {
        super(message);
    }
}
