package org.pragmatica.spacing.core;

/**
 * Spacing facts derived from a token's trivia and its preceding token.
 *
 * @param precededBySpace forced to {@code true} when the token is first in line
 * @param firstInLine     token has leading trivia or starts at column 0
 * @param followedBySpace token has trailing trivia
 * @param lastInLine      trailing trivia contains an end-of-line
 */
public record TriviaClassification(boolean precededBySpace,
                                   boolean firstInLine,
                                   boolean followedBySpace,
                                   boolean lastInLine) {
}
