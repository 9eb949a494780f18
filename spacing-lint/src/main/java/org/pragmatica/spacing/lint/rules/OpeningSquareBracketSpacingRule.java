package org.pragmatica.spacing.lint.rules;

import org.pragmatica.spacing.core.TokenScanner;
import org.pragmatica.spacing.core.TokenStream;
import org.pragmatica.spacing.core.Violation;
import org.pragmatica.spacing.lint.Diagnostic;
import org.pragmatica.spacing.lint.DiagnosticSeverity;
import org.pragmatica.spacing.lint.LintContext;
import org.pragmatica.spacing.lint.RuleDescriptor;

import java.util.stream.Stream;

/**
 * SA1010: Opening square brackets must be spaced correctly.
 *
 * An opening square bracket must never be preceded by whitespace, unless it is the first
 * character on the line, and must never be followed by whitespace, unless it is the last
 * character on the line. Brackets of attribute lists are left to their own rule, and so is
 * a space directly after {@code new}.
 */
public class OpeningSquareBracketSpacingRule implements LintRule {

    public static final String RULE_ID = "SA1010";

    public static final RuleDescriptor DESCRIPTOR = new RuleDescriptor(
            RULE_ID,
            "Opening square brackets must be spaced correctly",
            "Opening square brackets must {0} by a space.",
            "StyleCop.CSharp.SpacingRules",
            "An opening square bracket within a C# statement is not spaced correctly.",
            "http://www.stylecop.com/docs/SA1010.html",
            DiagnosticSeverity.WARNING,
            true
    );

    private final TokenScanner scanner = TokenScanner.openBracketScanner();

    @Override
    public RuleDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Stream<Diagnostic> analyze(TokenStream tokens, LintContext ctx) {
        if (!ctx.isRuleEnabled(DESCRIPTOR)) {
            return Stream.empty();
        }

        return scanner.scan(tokens)
                .map(violation -> createDiagnostic(violation, ctx));
    }

    private Diagnostic createDiagnostic(Violation violation, LintContext ctx) {
        var location = violation.location();
        var line = location.isKnown() ? location.line() + 1 : 1;
        var column = location.isKnown() ? location.column() + 1 : 1;

        return Diagnostic.diagnostic(
                RULE_ID,
                ctx.severityFor(DESCRIPTOR),
                ctx.fileName(),
                line,
                column,
                DESCRIPTOR.message(violation.kind()),
                DESCRIPTOR.description()
        ).withExample("""
                // Before
                var first = values [ 0];

                // After
                var first = values[0];
                """)
                .withDocLink(DESCRIPTOR.helpLink());
    }
}
