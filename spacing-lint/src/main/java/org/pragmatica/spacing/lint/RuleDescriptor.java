package org.pragmatica.spacing.lint;

import org.pragmatica.spacing.core.ViolationKind;

import java.text.MessageFormat;

/**
 * Static metadata describing a lint rule.
 *
 * @param id               rule identifier
 * @param title            short title
 * @param messageFormat    {@link MessageFormat} pattern with one argument, the violation fragment
 * @param category         rule family
 * @param description      longer description
 * @param helpLink         documentation link
 * @param defaultSeverity  severity used when configuration does not override it
 * @param enabledByDefault whether the rule runs without explicit configuration
 */
public record RuleDescriptor(String id,
                             String title,
                             String messageFormat,
                             String category,
                             String description,
                             String helpLink,
                             DiagnosticSeverity defaultSeverity,
                             boolean enabledByDefault) {

    /**
     * Render the user-facing message for the given violation.
     */
    public String message(ViolationKind kind) {
        return MessageFormat.format(messageFormat, kind.messageArgument());
    }
}
