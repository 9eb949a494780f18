package org.pragmatica.spacing.core;

/**
 * Category of non-semantic source text attached to a token.
 */
public enum TriviaKind {
    WHITESPACE,
    END_OF_LINE,
    COMMENT,
    OTHER
}
