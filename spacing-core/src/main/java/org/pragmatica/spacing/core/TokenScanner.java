package org.pragmatica.spacing.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Single-pass scanner applying the spacing rule to every token of a target kind.
 *
 * <p>Instances are immutable and may be shared between threads; each call to
 * {@link #scan(TokenStream)} produces an independent, lazily evaluated stream.
 */
public final class TokenScanner {

    private static final Logger log = LoggerFactory.getLogger(TokenScanner.class);

    private final TokenKind targetKind;
    private final Set<String> excludedParentKinds;
    private final SuppressionOracle suppressionOracle;

    private TokenScanner(TokenKind targetKind, Set<String> excludedParentKinds, SuppressionOracle suppressionOracle) {
        this.targetKind = Objects.requireNonNull(targetKind, "targetKind");
        this.excludedParentKinds = Set.copyOf(excludedParentKinds);
        this.suppressionOracle = Objects.requireNonNull(suppressionOracle, "suppressionOracle");
    }

    public static TokenScanner tokenScanner(TokenKind targetKind,
                                            Set<String> excludedParentKinds,
                                            SuppressionOracle suppressionOracle) {
        return new TokenScanner(targetKind, excludedParentKinds, suppressionOracle);
    }

    /**
     * Opening square brackets outside attribute lists; a space after {@code new} is left to its own rule.
     */
    public static TokenScanner openBracketScanner() {
        return new TokenScanner(TokenKind.OPEN_BRACKET,
                                Set.of(ParentKinds.ATTRIBUTE_LIST),
                                SuppressionOracle.precedingKind(TokenKind.NEW_KEYWORD));
    }

    public Stream<Violation> scan(TokenStream tokens) {
        return scan(tokens, CancellationSignal.NONE);
    }

    /**
     * Scan the stream in token order. Once cancellation is requested the result ends
     * before the next token is examined.
     */
    public Stream<Violation> scan(TokenStream tokens, CancellationSignal cancellation) {
        return IntStream.range(0, tokens.size())
                .takeWhile(index -> !cancellation.isCancellationRequested())
                .filter(index -> isCandidate(tokens.get(index)))
                .mapToObj(index -> check(tokens, index))
                .flatMap(Optional::stream);
    }

    /**
     * Evaluate a single token against its predecessor.
     */
    public Optional<Violation> check(TokenStream tokens, int index) {
        var token = tokens.get(index);
        var preceding = tokens.previous(index);
        var classification = TriviaClassifier.classify(token, preceding);
        var ignorePreceding = !classification.firstInLine()
                && suppressionOracle.suppressPrecedingViolation(token, preceding, classification.precededBySpace());

        return SpacingRuleEvaluator.evaluate(classification, ignorePreceding)
                .map(kind -> {
                    log.debug("{} at {}: {}", targetKind, token.location(), kind);
                    return Violation.violation(kind, token);
                });
    }

    private boolean isCandidate(Token token) {
        if (!token.is(targetKind)) {
            return false;
        }
        if (token.missing()) {
            log.trace("Skipping missing {} at {}", targetKind, token.location());
            return false;
        }
        return !excludedParentKinds.contains(token.parentKind());
    }
}
