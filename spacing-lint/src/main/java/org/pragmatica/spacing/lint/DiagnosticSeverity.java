package org.pragmatica.spacing.lint;

/**
 * Severity attached to a reported diagnostic.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO
}
