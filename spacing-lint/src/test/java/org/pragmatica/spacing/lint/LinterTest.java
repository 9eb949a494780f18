package org.pragmatica.spacing.lint;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.pragmatica.spacing.core.TokenKind;
import org.pragmatica.spacing.core.TokenStream;
import org.pragmatica.spacing.lint.rules.LintRule;
import org.pragmatica.spacing.lint.rules.OpeningSquareBracketSpacingRule;
import org.pragmatica.spacing.shared.SourceFile;

import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class LinterTest {
    private final Linter linter = Linter.linter();

    private static SourceFile source(String content) {
        return new SourceFile(Path.of("src", "Grid.java"), content);
    }

    @Test
    void lint_reportsDiagnosticsInSourceOrder() throws LintException {
        var diagnostics = linter.lint(source("""
                class Grid {
                    int[] cells = new int[ 4];

                    int cell(int index) {
                        return cells [index];
                    }
                }
                """), LintContext.defaultContext());

        assertThat(diagnostics).extracting(Diagnostic::line)
                .containsExactly(2, 5);
        assertThat(diagnostics).extracting(Diagnostic::file)
                .containsOnly(Path.of("src", "Grid.java").toString());
        assertThat(diagnostics.get(0).format())
                .isEqualTo(Path.of("src", "Grid.java") + ":2:26: WARNING [SA1010] Opening square brackets must not be followed by a space.");
    }

    @Test
    void lint_returnsEmpty_forWellSpacedSource() throws LintException {
        var diagnostics = linter.lint(source("""
                class Grid {
                    int[][] cells = new int[4][4];

                    int cell(int row, int column) {
                        return cells[row][column];
                    }
                }
                """), LintContext.defaultContext());

        assertThat(diagnostics).isEmpty();
    }

    @Test
    void lint_skipsDisabledRules() throws LintException {
        var ctx = LintContext.lintContext(LintConfig.defaultConfig().withDisabledRule("SA1010"));

        var diagnostics = linter.lint(source("""
                class Grid {
                    int[] cells = new int [ 4];
                }
                """), ctx);

        assertThat(diagnostics).isEmpty();
    }

    @Test
    void lint_propagatesParseErrors() {
        var error = Assertions.assertThrows(LintException.class,
                                            () -> linter.lint(source("class Grid {"), LintContext.defaultContext()));

        assertThat(error.error()).isInstanceOf(LintError.ParseError.class);
    }

    @Test
    void linter_exposesBuiltInRules() {
        assertThat(linter.rules()).extracting(LintRule::ruleId)
                .containsExactly("SA1010");
    }

    @Test
    void linter_runsCustomRules_withDescriptorDefaults() throws LintException {
        var custom = Linter.linter(List.of(new OpeningSquareBracketSpacingRule(), new OptInIdentifierRule()));
        var file = source("""
                class Grid {
                    int[] cells;
                }
                """);

        var byDefault = custom.lint(file, LintContext.defaultContext());
        var enabled = custom.lint(file, LintContext.lintContext(LintConfig.defaultConfig().withEnabledRule("SX0002")));

        assertThat(custom.rules()).extracting(LintRule::ruleId)
                .containsExactly("SA1010", "SX0002");
        assertThat(byDefault).isEmpty();
        assertThat(enabled).extracting(Diagnostic::severity)
                .containsOnly(DiagnosticSeverity.ERROR);
        assertThat(enabled).extracting(Diagnostic::message)
                .containsExactly("Identifier Grid.", "Identifier cells.");
    }

    /**
     * Off by default; reports every identifier at the descriptor's severity.
     */
    private static final class OptInIdentifierRule implements LintRule {
        private static final RuleDescriptor DESCRIPTOR = new RuleDescriptor(
                "SX0002",
                "Identifiers",
                "Identifier {0}.",
                "Test",
                "Reports identifiers.",
                "",
                DiagnosticSeverity.ERROR,
                false
        );

        @Override
        public RuleDescriptor descriptor() {
            return DESCRIPTOR;
        }

        @Override
        public Stream<Diagnostic> analyze(TokenStream tokens, LintContext ctx) {
            return tokens.tokens()
                    .stream()
                    .filter(token -> token.is(TokenKind.IDENTIFIER))
                    .map(token -> Diagnostic.diagnostic(DESCRIPTOR.id(),
                                                        ctx.severityFor(DESCRIPTOR),
                                                        ctx.fileName(),
                                                        token.location().line() + 1,
                                                        token.location().column() + 1,
                                                        MessageFormat.format(DESCRIPTOR.messageFormat(), token.text()),
                                                        DESCRIPTOR.description()));
        }
    }
}
