package org.pragmatica.spacing.core;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, finite sequence of tokens for one source file.
 *
 * The preceding-token relation is positional lookup only; tokens do not reference each other.
 */
public interface TokenStream extends Iterable<Token> {

    int size();

    Token get(int index);

    default Optional<Token> previous(int index) {
        return index > 0 && index <= size()
               ? Optional.of(get(index - 1))
               : Optional.empty();
    }

    @Override
    default Iterator<Token> iterator() {
        return tokens().iterator();
    }

    List<Token> tokens();

    /**
     * Token stream backed by an immutable copy of the given list.
     */
    static TokenStream tokenStream(List<Token> tokens) {
        record ListTokenStream(List<Token> tokens) implements TokenStream {
            @Override
            public int size() {
                return tokens.size();
            }

            @Override
            public Token get(int index) {
                return tokens.get(index);
            }
        }

        return new ListTokenStream(List.copyOf(tokens));
    }

    static TokenStream empty() {
        return tokenStream(List.of());
    }
}
