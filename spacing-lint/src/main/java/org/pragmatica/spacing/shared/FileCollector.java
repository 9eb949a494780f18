package org.pragmatica.spacing.shared;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Utility for collecting Java source files from paths.
 */
public final class FileCollector {

    private FileCollector() {}

    /**
     * Collect Java files from a list of paths (files or directories).
     * Directories are scanned recursively; results keep argument order, sorted within each directory tree.
     *
     * @param paths        List of paths to collect from
     * @param errorHandler Handler for errors during collection
     * @return List of Java file paths
     */
    public static List<Path> collectJavaFiles(List<Path> paths, Consumer<String> errorHandler) {
        var files = new ArrayList<Path>();

        for (var path : paths) {
            if (Files.isDirectory(path)) {
                collectFromDirectory(path, files, errorHandler);
            } else if (!Files.exists(path)) {
                errorHandler.accept("Path not found: " + path);
            } else if (isJavaFile(path)) {
                files.add(path);
            }
        }

        return files;
    }

    private static void collectFromDirectory(Path directory, List<Path> files, Consumer<String> errorHandler) {
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.filter(Files::isRegularFile)
                .filter(FileCollector::isJavaFile)
                .sorted()
                .forEach(files::add);
        } catch (IOException | UncheckedIOException e) {
            errorHandler.accept("Error scanning " + directory + ": " + e.getMessage());
        }
    }

    private static boolean isJavaFile(Path path) {
        return path.toString().endsWith(".java");
    }
}
