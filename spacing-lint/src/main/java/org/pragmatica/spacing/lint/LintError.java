package org.pragmatica.spacing.lint;

/**
 * Errors that prevent a file or configuration from being linted.
 */
public sealed interface LintError {

    String message();

    /**
     * The source could not be parsed into tokens.
     */
    record ParseError(String file, int line, int column, String details) implements LintError {
        @Override
        public String message() {
            return "Parse error in " + file + " at " + line + ":" + column + ": " + details;
        }
    }

    /**
     * The source or configuration file could not be read.
     */
    record IoError(String file, String details) implements LintError {
        @Override
        public String message() {
            return "Cannot read " + file + ": " + details;
        }
    }

    /**
     * The configuration contains an invalid value.
     */
    record ConfigError(String details) implements LintError {
        @Override
        public String message() {
            return "Invalid configuration: " + details;
        }
    }

    static LintError parseError(String file, int line, int column, String details) {
        return new ParseError(file, line, column, details);
    }

    static LintError ioError(String file, String details) {
        return new IoError(file, details);
    }

    static LintError configError(String details) {
        return new ConfigError(details);
    }

    default LintException exception() {
        return new LintException(this);
    }

    default LintException exception(Throwable cause) {
        return new LintException(this, cause);
    }
}
