package org.pragmatica.spacing.lint;

import java.util.Comparator;

/**
 * A single finding reported by a lint rule.
 *
 * @param ruleId   rule identifier, e.g. "SA1010"
 * @param severity configured severity
 * @param file     file the finding belongs to
 * @param line     1-based line
 * @param column   1-based column
 * @param message  user-facing message
 * @param detail   longer explanation of the rule
 * @param example  optional code example, empty when absent
 * @param docLink  optional documentation link, empty when absent
 */
public record Diagnostic(String ruleId,
                         DiagnosticSeverity severity,
                         String file,
                         int line,
                         int column,
                         String message,
                         String detail,
                         String example,
                         String docLink) {

    /**
     * Orders diagnostics by file, then position, then rule.
     */
    public static final Comparator<Diagnostic> BY_POSITION = Comparator.comparing(Diagnostic::file)
            .thenComparingInt(Diagnostic::line)
            .thenComparingInt(Diagnostic::column)
            .thenComparing(Diagnostic::ruleId);

    public Diagnostic {
        example = example == null ? "" : example;
        docLink = docLink == null ? "" : docLink;
    }

    public static Diagnostic diagnostic(String ruleId,
                                        DiagnosticSeverity severity,
                                        String file,
                                        int line,
                                        int column,
                                        String message,
                                        String detail) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, "", "");
    }

    public Diagnostic withExample(String example) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, example, docLink);
    }

    public Diagnostic withDocLink(String docLink) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, example, docLink);
    }

    public boolean isError() {
        return severity == DiagnosticSeverity.ERROR;
    }

    public boolean isWarning() {
        return severity == DiagnosticSeverity.WARNING;
    }

    /**
     * Compiler-style one-line rendering: {@code file:line:column: SEVERITY [rule] message}.
     */
    public String format() {
        return file + ":" + line + ":" + column + ": " + severity + " [" + ruleId + "] " + message;
    }
}
