package org.pragmatica.spacing.lint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration for the spacing linter.
 */
public record LintConfig(Map<String, DiagnosticSeverity> ruleSeverities,
                         Set<String> enabledRules,
                         Set<String> disabledRules,
                         boolean failOnWarning) {

    private static final String RULE_PREFIX = "rule.";
    private static final String SEVERITY_SUFFIX = ".severity";
    private static final String ENABLED_SUFFIX = ".enabled";
    private static final String FAIL_ON_WARNING = "failOnWarning";

    /**
     * Default lint configuration: every rule runs as its descriptor declares.
     */
    public static final LintConfig DEFAULT = new LintConfig(Map.of(), Set.of(), Set.of(), false);

    public LintConfig {
        ruleSeverities = Map.copyOf(ruleSeverities);
        enabledRules = Set.copyOf(enabledRules);
        disabledRules = Set.copyOf(disabledRules);
    }

    /**
     * Factory method for default config.
     */
    public static LintConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Build configuration from properties, starting from the defaults.
     *
     * <p>Recognized keys: {@code rule.<ID>.severity} (ERROR, WARNING, INFO),
     * {@code rule.<ID>.enabled} (true/false) and {@code failOnWarning}.
     *
     * @throws LintException with {@link LintError.ConfigError} for an unknown severity, a key
     *                       without a rule ID or any other {@code rule.*} key
     */
    public static LintConfig fromProperties(Properties properties) throws LintException {
        var config = defaultConfig();

        for (var key : properties.stringPropertyNames()) {
            var value = properties.getProperty(key).trim();

            if (key.equals(FAIL_ON_WARNING)) {
                config = config.withFailOnWarning(Boolean.parseBoolean(value));
            } else if (key.startsWith(RULE_PREFIX) && key.endsWith(SEVERITY_SUFFIX)) {
                var ruleId = ruleId(key, SEVERITY_SUFFIX);
                config = config.withRuleSeverity(ruleId, parseSeverity(key, value));
            } else if (key.startsWith(RULE_PREFIX) && key.endsWith(ENABLED_SUFFIX)) {
                var ruleId = ruleId(key, ENABLED_SUFFIX);
                config = Boolean.parseBoolean(value)
                         ? config.withEnabledRule(ruleId)
                         : config.withDisabledRule(ruleId);
            } else if (key.startsWith(RULE_PREFIX)) {
                throw LintError.configError("unknown rule setting " + key).exception();
            }
        }
        return config;
    }

    private static String ruleId(String key, String suffix) throws LintException {
        if (key.length() <= RULE_PREFIX.length() + suffix.length()) {
            throw LintError.configError("missing rule ID in " + key).exception();
        }

        var ruleId = key.substring(RULE_PREFIX.length(), key.length() - suffix.length()).trim();

        if (ruleId.isEmpty()) {
            throw LintError.configError("missing rule ID in " + key).exception();
        }
        return ruleId;
    }

    private static DiagnosticSeverity parseSeverity(String key, String value) throws LintException {
        try {
            return DiagnosticSeverity.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw LintError.configError("unknown severity '" + value + "' for " + key).exception(e);
        }
    }

    /**
     * Builder-style method to set rule severity.
     */
    public LintConfig withRuleSeverity(String ruleId, DiagnosticSeverity severity) {
        var newSeverities = new HashMap<>(ruleSeverities);
        newSeverities.put(ruleId, severity);
        return new LintConfig(newSeverities, enabledRules, disabledRules, failOnWarning);
    }

    /**
     * Builder-style method to disable a rule.
     */
    public LintConfig withDisabledRule(String ruleId) {
        var newEnabled = new HashSet<>(enabledRules);
        var newDisabled = new HashSet<>(disabledRules);
        newEnabled.remove(ruleId);
        newDisabled.add(ruleId);
        return new LintConfig(ruleSeverities, newEnabled, newDisabled, failOnWarning);
    }

    /**
     * Builder-style method to enable a rule, including one that is off by default.
     */
    public LintConfig withEnabledRule(String ruleId) {
        var newEnabled = new HashSet<>(enabledRules);
        var newDisabled = new HashSet<>(disabledRules);
        newEnabled.add(ruleId);
        newDisabled.remove(ruleId);
        return new LintConfig(ruleSeverities, newEnabled, newDisabled, failOnWarning);
    }

    /**
     * Builder-style method to set fail on warning.
     */
    public LintConfig withFailOnWarning(boolean failOnWarning) {
        return new LintConfig(ruleSeverities, enabledRules, disabledRules, failOnWarning);
    }
}
