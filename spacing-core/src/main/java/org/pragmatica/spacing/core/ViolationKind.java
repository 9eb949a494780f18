package org.pragmatica.spacing.core;

/**
 * Outcome of a spacing check that found a problem.
 */
public enum ViolationKind {
    NEITHER_SIDE("neither be preceded nor followed"),
    NOT_PRECEDED("not be preceded"),
    NOT_FOLLOWED("not be followed");

    private final String messageArgument;

    ViolationKind(String messageArgument) {
        this.messageArgument = messageArgument;
    }

    /**
     * Fragment substituted into a rule's message format, e.g. "must {0} by a space".
     */
    public String messageArgument() {
        return messageArgument;
    }
}
