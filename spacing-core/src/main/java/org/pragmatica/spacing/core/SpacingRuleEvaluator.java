package org.pragmatica.spacing.core;

import java.util.Optional;

/**
 * Selects at most one violation from the classified spacing facts.
 *
 * <p>The checks form a priority list and must stay in this order: a token with an illegal
 * space before it is always reported for the preceding side (alone or combined), and the
 * following side is reported only when the preceding side was clean or suppressed.
 */
public final class SpacingRuleEvaluator {

    private SpacingRuleEvaluator() {}

    public static Optional<ViolationKind> evaluate(boolean firstInLine,
                                                   boolean precededBySpace,
                                                   boolean ignorePreceding,
                                                   boolean lastInLine,
                                                   boolean followedBySpace) {
        var precedingProblem = !firstInLine && precededBySpace && !ignorePreceding;
        var followingProblem = !lastInLine && followedBySpace;

        if (precedingProblem && followingProblem) {
            return Optional.of(ViolationKind.NEITHER_SIDE);
        }
        if (precedingProblem) {
            return Optional.of(ViolationKind.NOT_PRECEDED);
        }
        if (followingProblem) {
            return Optional.of(ViolationKind.NOT_FOLLOWED);
        }
        return Optional.empty();
    }

    public static Optional<ViolationKind> evaluate(TriviaClassification classification, boolean ignorePreceding) {
        return evaluate(classification.firstInLine(),
                        classification.precededBySpace(),
                        ignorePreceding,
                        classification.lastInLine(),
                        classification.followedBySpace());
    }
}
