package org.pragmatica.spacing.core;

/**
 * Lexical category of a significant token.
 *
 * Only the categories the spacing rules distinguish are named individually,
 * everything else is folded into the broad groups.
 */
public enum TokenKind {
    OPEN_BRACKET,
    CLOSE_BRACKET,
    OPEN_PAREN,
    CLOSE_PAREN,
    NEW_KEYWORD,
    KEYWORD,
    IDENTIFIER,
    LITERAL,
    SEPARATOR,
    OPERATOR,
    END_OF_FILE,
    OTHER
}
