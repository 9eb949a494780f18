package org.pragmatica.spacing.core;

/**
 * A spacing violation anchored at the offending token.
 */
public record Violation(ViolationKind kind, Token token) {

    public static Violation violation(ViolationKind kind, Token token) {
        return new Violation(kind, token);
    }

    public SourceLocation location() {
        return token.location();
    }
}
