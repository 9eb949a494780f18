package org.pragmatica.spacing.core;

import java.util.List;
import java.util.Objects;

/**
 * Immutable significant token together with the trivia it owns.
 *
 * Missing trivia lists, parent kind or location are normalized to "no information":
 * empty trivia, {@link ParentKinds#UNKNOWN} and {@link SourceLocation#unknown()}.
 *
 * @param kind           lexical category
 * @param text           token text
 * @param leadingTrivia  trivia before the token, in source order
 * @param trailingTrivia trivia after the token, in source order
 * @param parentKind     syntactic category of the enclosing construct
 * @param location       mapped position of the first character
 * @param missing        true for placeholders synthesized by parser error recovery
 */
public record Token(TokenKind kind,
                    String text,
                    List<Trivia> leadingTrivia,
                    List<Trivia> trailingTrivia,
                    String parentKind,
                    SourceLocation location,
                    boolean missing) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
        leadingTrivia = leadingTrivia == null ? List.of() : List.copyOf(leadingTrivia);
        trailingTrivia = trailingTrivia == null ? List.of() : List.copyOf(trailingTrivia);
        parentKind = parentKind == null ? ParentKinds.UNKNOWN : parentKind;
        location = location == null ? SourceLocation.unknown() : location;
    }

    /**
     * Factory for a token present in the source text.
     */
    public static Token token(TokenKind kind,
                              String text,
                              List<Trivia> leadingTrivia,
                              List<Trivia> trailingTrivia,
                              String parentKind,
                              SourceLocation location) {
        return new Token(kind, text, leadingTrivia, trailingTrivia, parentKind, location, false);
    }

    /**
     * Factory for a placeholder inserted by parser error recovery.
     */
    public static Token missingToken(TokenKind kind, String parentKind, SourceLocation location) {
        return new Token(kind, "", List.of(), List.of(), parentKind, location, true);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public boolean hasLeadingTrivia() {
        return !leadingTrivia.isEmpty();
    }

    public boolean hasTrailingTrivia() {
        return !trailingTrivia.isEmpty();
    }

    public boolean trailingTriviaContains(TriviaKind triviaKind) {
        return trailingTrivia.stream()
                .anyMatch(trivia -> trivia.kind() == triviaKind);
    }
}
