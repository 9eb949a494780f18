package org.pragmatica.spacing.cli;

import org.pragmatica.spacing.lint.Diagnostic;
import org.pragmatica.spacing.lint.LintConfig;
import org.pragmatica.spacing.lint.LintContext;
import org.pragmatica.spacing.lint.LintError;
import org.pragmatica.spacing.lint.LintException;
import org.pragmatica.spacing.lint.Linter;
import org.pragmatica.spacing.shared.FileCollector;
import org.pragmatica.spacing.shared.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;

/**
 * Lint command - checks bracket spacing in Java sources.
 */
@Command(
        name = "spacing-lint",
        description = "Check spacing around opening square brackets in Java sources",
        mixinStandardHelpOptions = true,
        version = "spacing-lint 0.1.0"
)
public class LintCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_FAILURE = 2;

    private static final Logger log = LoggerFactory.getLogger(LintCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(
            paramLabel = "<path>",
            description = "Files or directories to lint",
            arity = "1..*"
    )
    List<Path> paths;

    @Option(
            names = {"--fail-on-warning", "-w"},
            description = "Treat warnings as errors"
    )
    boolean failOnWarning;

    @Option(
            names = {"--config", "-c"},
            paramLabel = "<file>",
            description = "Properties file with rule settings"
    )
    Path configFile;

    @Option(
            names = {"--disable", "-d"},
            paramLabel = "<ruleId>",
            description = "Disable a rule (repeatable)"
    )
    List<String> disabledRules = new ArrayList<>();

    private final Linter linter = Linter.linter();

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        LintConfig config;
        try {
            config = loadConfig();
        } catch (LintException e) {
            err.println(e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }

        var problems = new ArrayList<String>();
        var files = FileCollector.collectJavaFiles(paths, problems::add);
        var summary = lintFiles(files, LintContext.lintContext(config), out, problems);

        problems.forEach(err::println);
        out.println("Checked " + files.size() + " file(s): "
                    + summary.errors() + " error(s), " + summary.warnings() + " warning(s)");
        out.flush();
        err.flush();

        if (!problems.isEmpty()) {
            return EXIT_FAILURE;
        }
        if (summary.errors() > 0 || (config.failOnWarning() && summary.warnings() > 0)) {
            return EXIT_VIOLATIONS;
        }
        return EXIT_OK;
    }

    private Summary lintFiles(List<Path> files, LintContext ctx, PrintWriter out, List<String> problems) {
        var errors = 0;
        var warnings = 0;

        for (var file : files) {
            try {
                var diagnostics = linter.lint(SourceFile.sourceFile(file), ctx);
                for (var diagnostic : diagnostics) {
                    out.println(diagnostic.format());
                }
                errors += (int) diagnostics.stream().filter(Diagnostic::isError).count();
                warnings += (int) diagnostics.stream().filter(Diagnostic::isWarning).count();
            } catch (LintException e) {
                log.debug("Skipping {}", file, e);
                problems.add(e.getMessage());
            }
        }
        return new Summary(errors, warnings);
    }

    private LintConfig loadConfig() throws LintException {
        var config = configFile == null
                     ? LintConfig.defaultConfig()
                     : LintConfig.fromProperties(readProperties(configFile));

        for (var ruleId : disabledRules) {
            config = config.withDisabledRule(ruleId);
        }
        return failOnWarning
               ? config.withFailOnWarning(true)
               : config;
    }

    private static Properties readProperties(Path file) throws LintException {
        var properties = new Properties();
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
            return properties;
        } catch (IOException e) {
            throw LintError.ioError(file.toString(), e.getMessage()).exception(e);
        }
    }

    private record Summary(int errors, int warnings) {}
}
