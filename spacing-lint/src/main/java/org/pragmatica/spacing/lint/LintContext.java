package org.pragmatica.spacing.lint;

/**
 * Context for lint analysis of a single file.
 */
public record LintContext(LintConfig config, String fileName) {

    /**
     * Get the severity for a rule: the configured one, otherwise the descriptor's default.
     */
    public DiagnosticSeverity severityFor(RuleDescriptor rule) {
        return config.ruleSeverities()
                .getOrDefault(rule.id(), rule.defaultSeverity());
    }

    /**
     * Check if a rule is enabled. Explicit configuration wins over the descriptor's default.
     */
    public boolean isRuleEnabled(RuleDescriptor rule) {
        if (config.disabledRules().contains(rule.id())) {
            return false;
        }
        return rule.enabledByDefault() || config.enabledRules().contains(rule.id());
    }

    /**
     * Factory method with default configuration.
     */
    public static LintContext defaultContext() {
        return new LintContext(LintConfig.defaultConfig(), "Unknown.java");
    }

    public static LintContext lintContext(LintConfig config) {
        return new LintContext(config, "Unknown.java");
    }

    /**
     * Builder-style method to set file name.
     */
    public LintContext withFileName(String fileName) {
        return new LintContext(config, fileName);
    }
}
