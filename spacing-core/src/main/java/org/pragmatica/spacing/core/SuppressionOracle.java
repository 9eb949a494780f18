package org.pragmatica.spacing.core;

import java.util.Optional;

/**
 * Decides whether a "preceded by space" finding belongs to another, more specific rule.
 *
 * Only the preceding side can be suppressed.
 */
@FunctionalInterface
public interface SuppressionOracle {

    boolean suppressPrecedingViolation(Token token, Optional<Token> preceding, boolean precededBySpace);

    /**
     * Suppress when the space follows a token of the given kind, e.g. {@code new [}.
     */
    static SuppressionOracle precedingKind(TokenKind kind) {
        return (token, preceding, precededBySpace) -> precededBySpace
                && preceding.map(previous -> previous.is(kind)).orElse(false);
    }

    static SuppressionOracle none() {
        return (token, preceding, precededBySpace) -> false;
    }
}
