package org.pragmatica.spacing.lint;

import org.pragmatica.spacing.core.TokenStream;
import org.pragmatica.spacing.java.JavaTokenStreams;
import org.pragmatica.spacing.lint.rules.LintRule;
import org.pragmatica.spacing.lint.rules.OpeningSquareBracketSpacingRule;
import org.pragmatica.spacing.shared.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs a fixed set of lint rules over source files.
 */
public final class Linter {

    private static final Logger log = LoggerFactory.getLogger(Linter.class);

    private final List<LintRule> rules;

    private Linter(List<LintRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Linter with all built-in rules.
     */
    public static Linter linter() {
        return new Linter(List.of(new OpeningSquareBracketSpacingRule()));
    }

    /**
     * Linter with the given rules, in addition to or instead of the built-in ones.
     */
    public static Linter linter(List<LintRule> rules) {
        return new Linter(rules);
    }

    public List<LintRule> rules() {
        return rules;
    }

    /**
     * Lint a Java source file.
     *
     * @throws LintException when the file cannot be tokenized
     */
    public List<Diagnostic> lint(SourceFile source, LintContext ctx) throws LintException {
        var tokens = JavaTokenStreams.tokenStream(source);
        return lint(tokens, ctx.withFileName(source.fileName()));
    }

    /**
     * Lint an already tokenized file; diagnostics are sorted by position.
     */
    public List<Diagnostic> lint(TokenStream tokens, LintContext ctx) {
        var diagnostics = rules.stream()
                .filter(rule -> ctx.isRuleEnabled(rule.descriptor()))
                .flatMap(rule -> rule.analyze(tokens, ctx))
                .sorted(Diagnostic.BY_POSITION)
                .toList();

        log.debug("{}: {} diagnostic(s)", ctx.fileName(), diagnostics.size());
        return diagnostics;
    }
}
