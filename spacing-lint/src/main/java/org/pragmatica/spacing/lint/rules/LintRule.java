package org.pragmatica.spacing.lint.rules;

import org.pragmatica.spacing.core.TokenStream;
import org.pragmatica.spacing.lint.Diagnostic;
import org.pragmatica.spacing.lint.LintContext;
import org.pragmatica.spacing.lint.RuleDescriptor;

import java.util.stream.Stream;

/**
 * Interface for token-based lint rules.
 *
 * Each rule analyzes the token stream of one file and produces zero or more diagnostics.
 */
public interface LintRule {

    /**
     * Static metadata of the rule.
     */
    RuleDescriptor descriptor();

    /**
     * Get the rule ID (e.g., "SA1010").
     */
    default String ruleId() {
        return descriptor().id();
    }

    /**
     * Get a short description of what this rule checks.
     */
    default String description() {
        return descriptor().title();
    }

    /**
     * Analyze a token stream and return any diagnostics.
     *
     * @param tokens the tokens of the file to analyze
     * @param ctx    the lint context providing configuration
     * @return stream of diagnostics found
     */
    Stream<Diagnostic> analyze(TokenStream tokens, LintContext ctx);
}
