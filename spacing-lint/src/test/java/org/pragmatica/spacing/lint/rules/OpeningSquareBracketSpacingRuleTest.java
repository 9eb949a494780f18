package org.pragmatica.spacing.lint.rules;

import org.junit.jupiter.api.Test;
import org.pragmatica.spacing.core.TokenStream;
import org.pragmatica.spacing.core.ViolationKind;
import org.pragmatica.spacing.java.JavaTokenStreams;
import org.pragmatica.spacing.lint.Diagnostic;
import org.pragmatica.spacing.lint.DiagnosticSeverity;
import org.pragmatica.spacing.lint.LintConfig;
import org.pragmatica.spacing.lint.LintContext;
import org.pragmatica.spacing.lint.LintException;
import org.pragmatica.spacing.shared.SourceFile;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpeningSquareBracketSpacingRuleTest {
    private final OpeningSquareBracketSpacingRule rule = new OpeningSquareBracketSpacingRule();

    private static TokenStream tokens(String source) throws LintException {
        return JavaTokenStreams.tokenStream(new SourceFile(Path.of("Sample.java"), source));
    }

    private List<Diagnostic> analyze(String source, LintContext ctx) throws LintException {
        return rule.analyze(tokens(source), ctx.withFileName("Sample.java")).toList();
    }

    @Test
    void analyze_reportsNotPreceded_withOneBasedPosition() throws LintException {
        var diagnostics = analyze("""
                class Sample {
                    int[] values = new int[3];

                    int first() {
                        return values [0];
                    }
                }
                """, LintContext.defaultContext());

        assertThat(diagnostics).hasSize(1);
        var diagnostic = diagnostics.get(0);
        assertThat(diagnostic.ruleId()).isEqualTo("SA1010");
        assertThat(diagnostic.severity()).isEqualTo(DiagnosticSeverity.WARNING);
        assertThat(diagnostic.file()).isEqualTo("Sample.java");
        assertThat(diagnostic.line()).isEqualTo(5);
        assertThat(diagnostic.column()).isEqualTo(23);
        assertThat(diagnostic.message()).isEqualTo("Opening square brackets must not be preceded by a space.");
        assertThat(diagnostic.docLink()).isEqualTo("http://www.stylecop.com/docs/SA1010.html");
    }

    @Test
    void analyze_rendersAllThreeMessages() throws LintException {
        var diagnostics = analyze("""
                class Sample {
                    int a(int[] v) {
                        return v [0] + v[ 1] + v [ 2];
                    }
                }
                """, LintContext.defaultContext());

        assertThat(diagnostics).extracting(Diagnostic::message)
                .containsExactly("Opening square brackets must not be preceded by a space.",
                                 "Opening square brackets must not be followed by a space.",
                                 "Opening square brackets must neither be preceded nor followed by a space.");
    }

    @Test
    void analyze_acceptsBracketsAtLineEdges() throws LintException {
        var diagnostics = analyze("""
                class Sample {
                    int cell(int[][] grid, int row, int column) {
                        return grid[row]
                            [column] + grid[
                            row][column];
                    }
                }
                """, LintContext.defaultContext());

        assertThat(diagnostics).isEmpty();
    }

    @Test
    void analyze_reportsSpaceBeforeArrayTypeBrackets() throws LintException {
        var diagnostics = analyze("""
                class Sample {
                    public static void main(String [] args) {
                    }
                }
                """, LintContext.defaultContext());

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).line()).isEqualTo(2);
        assertThat(diagnostics.get(0).column()).isEqualTo(36);
    }

    @Test
    void analyze_treatsCommentBeforeBracketAsSpace() throws LintException {
        var diagnostics = analyze("""
                class Sample {
                    int first(int[] values) {
                        return values/* first */[0];
                    }
                }
                """, LintContext.defaultContext());

        assertThat(diagnostics).extracting(Diagnostic::message)
                .containsExactly("Opening square brackets must not be preceded by a space.");
    }

    @Test
    void analyze_usesConfiguredSeverity() throws LintException {
        var ctx = LintContext.lintContext(LintConfig.defaultConfig()
                .withRuleSeverity("SA1010", DiagnosticSeverity.ERROR));

        var diagnostics = analyze("""
                class Sample {
                    int[] values = new int [3];
                }
                """, ctx);

        assertThat(diagnostics).extracting(Diagnostic::severity)
                .containsExactly(DiagnosticSeverity.ERROR);
    }

    @Test
    void analyze_usesDescriptorSeverity_whenConfigHasNoEntryForRule() throws LintException {
        var ctx = LintContext.lintContext(LintConfig.defaultConfig()
                .withRuleSeverity("SA1011", DiagnosticSeverity.ERROR));

        var diagnostics = analyze("""
                class Sample {
                    int[] values = new int [3];
                }
                """, ctx);

        assertThat(ctx.config().ruleSeverities()).doesNotContainKey("SA1010");
        assertThat(diagnostics).extracting(Diagnostic::severity)
                .containsExactly(OpeningSquareBracketSpacingRule.DESCRIPTOR.defaultSeverity());
    }

    @Test
    void analyze_returnsNothing_whenRuleDisabled() throws LintException {
        var ctx = LintContext.lintContext(LintConfig.defaultConfig().withDisabledRule("SA1010"));

        var diagnostics = analyze("""
                class Sample {
                    int[] values = new int [ 3];
                }
                """, ctx);

        assertThat(diagnostics).isEmpty();
    }

    @Test
    void descriptor_rendersMessageFromFormat() {
        assertThat(rule.ruleId()).isEqualTo("SA1010");
        assertThat(rule.description()).isEqualTo("Opening square brackets must be spaced correctly");
        assertThat(rule.descriptor().message(ViolationKind.NOT_FOLLOWED))
                .isEqualTo("Opening square brackets must not be followed by a space.");
        assertThat(rule.descriptor().enabledByDefault()).isTrue();
    }
}
