package org.pragmatica.spacing.lint;

/**
 * Checked exception carrying a {@link LintError}.
 */
public class LintException extends Exception {

    private final transient LintError error;

    public LintException(LintError error) {
        super(error.message());
        this.error = error;
    }

    public LintException(LintError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public LintError error() {
        return error;
    }
}
