package org.pragmatica.spacing.core;

import java.util.Objects;

/**
 * A single piece of trivia (whitespace, line break, comment) owned by a token.
 *
 * @param kind trivia category
 * @param text raw source text of the trivia
 */
public record Trivia(TriviaKind kind, String text) {

    public Trivia {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
    }

    public static Trivia whitespace(String text) {
        return new Trivia(TriviaKind.WHITESPACE, text);
    }

    public static Trivia endOfLine(String text) {
        return new Trivia(TriviaKind.END_OF_LINE, text);
    }

    public static Trivia comment(String text) {
        return new Trivia(TriviaKind.COMMENT, text);
    }

    public boolean isEndOfLine() {
        return kind == TriviaKind.END_OF_LINE;
    }
}
