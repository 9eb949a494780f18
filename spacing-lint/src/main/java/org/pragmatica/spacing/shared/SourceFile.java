package org.pragmatica.spacing.shared;

import org.pragmatica.spacing.lint.LintError;
import org.pragmatica.spacing.lint.LintException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Source text together with the path it was read from.
 */
public record SourceFile(Path path, String content) {

    /**
     * Read a source file as UTF-8.
     */
    public static SourceFile sourceFile(Path path) throws LintException {
        try {
            return new SourceFile(path, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw LintError.ioError(path.toString(), e.getMessage()).exception(e);
        }
    }

    public String fileName() {
        return path.toString();
    }
}
