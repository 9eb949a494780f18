package org.pragmatica.spacing.cli;

import picocli.CommandLine;

/**
 * Command line entry point.
 */
public final class SpacingLintCli {

    private SpacingLintCli() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new LintCommand());
    }
}
