package org.pragmatica.spacing.core;

import java.util.Optional;

/**
 * Derives line-position and adjacent-space facts for a single token.
 */
public final class TriviaClassifier {

    private TriviaClassifier() {}

    /**
     * Classify the token.
     *
     * <p>Any leading trivia counts as "first in line", including a comment on the same line.
     * The preceding side is judged by the previous token's trailing trivia, not by the
     * token's own leading trivia.
     *
     * @param token     token to classify
     * @param preceding token immediately before it, if any
     * @return the four spacing facts
     */
    public static TriviaClassification classify(Token token, Optional<Token> preceding) {
        var firstInLine = token.hasLeadingTrivia() || token.location().isLineStart();
        var precededBySpace = firstInLine || preceding.map(Token::hasTrailingTrivia).orElse(false);
        var followedBySpace = token.hasTrailingTrivia();
        var lastInLine = followedBySpace && token.trailingTriviaContains(TriviaKind.END_OF_LINE);

        return new TriviaClassification(precededBySpace, firstInLine, followedBySpace, lastInLine);
    }
}
