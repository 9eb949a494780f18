package org.pragmatica.spacing.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link TokenStream} from lexemes delivered in source order, distributing trivia
 * between neighbouring tokens.
 *
 * <p>A token owns as trailing trivia everything that follows it on the same line, up to and
 * including the first end-of-line. All other trivia between two tokens is leading trivia of the
 * later token. Trivia left after the last token goes to a synthesized end-of-file token.
 *
 * <p>Not thread-safe; use one instance per source file.
 */
public final class TriviaAttacher {

    private final List<Token> tokens = new ArrayList<>();
    private List<Trivia> pendingLeading = new ArrayList<>();
    private PendingToken current;
    private boolean collectingTrailing;

    private TriviaAttacher() {}

    public static TriviaAttacher triviaAttacher() {
        return new TriviaAttacher();
    }

    public TriviaAttacher trivia(Trivia trivia) {
        if (current != null && collectingTrailing) {
            current.trailing.add(trivia);
            if (trivia.isEndOfLine()) {
                collectingTrailing = false;
            }
        } else {
            pendingLeading.add(trivia);
        }
        return this;
    }

    public TriviaAttacher token(TokenKind kind, String text, String parentKind, SourceLocation location) {
        return append(new PendingToken(kind, text, parentKind, location, false));
    }

    public TriviaAttacher missingToken(TokenKind kind, String parentKind, SourceLocation location) {
        // error-recovery placeholders own no text and therefore no trailing trivia
        append(new PendingToken(kind, "", parentKind, location, true));
        collectingTrailing = false;
        return this;
    }

    public TokenStream build() {
        flushCurrent();
        if (!pendingLeading.isEmpty()) {
            tokens.add(Token.token(TokenKind.END_OF_FILE,
                                   "",
                                   pendingLeading,
                                   List.of(),
                                   ParentKinds.UNKNOWN,
                                   SourceLocation.unknown()));
            pendingLeading = new ArrayList<>();
        }
        return TokenStream.tokenStream(tokens);
    }

    private TriviaAttacher append(PendingToken next) {
        flushCurrent();
        next.leading.addAll(pendingLeading);
        pendingLeading = new ArrayList<>();
        current = next;
        collectingTrailing = true;
        return this;
    }

    private void flushCurrent() {
        if (current != null) {
            tokens.add(current.toToken());
            current = null;
        }
    }

    private static final class PendingToken {
        private final TokenKind kind;
        private final String text;
        private final String parentKind;
        private final SourceLocation location;
        private final boolean missing;
        private final List<Trivia> leading = new ArrayList<>();
        private final List<Trivia> trailing = new ArrayList<>();

        private PendingToken(TokenKind kind, String text, String parentKind, SourceLocation location, boolean missing) {
            this.kind = kind;
            this.text = text;
            this.parentKind = parentKind;
            this.location = location;
            this.missing = missing;
        }

        private Token toToken() {
            return new Token(kind, text, leading, trailing, parentKind, location, missing);
        }
    }
}
