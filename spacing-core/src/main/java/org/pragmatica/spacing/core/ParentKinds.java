package org.pragmatica.spacing.core;

/**
 * Well-known names of enclosing syntactic constructs.
 *
 * Parent kinds are plain strings so that any token source can report its own
 * syntax categories without extending a shared enum.
 */
public final class ParentKinds {

    /**
     * Bracketed attribute/annotation list, e.g. {@code [Serializable]}.
     */
    public static final String ATTRIBUTE_LIST = "AttributeList";

    public static final String UNKNOWN = "Unknown";

    private ParentKinds() {}
}
