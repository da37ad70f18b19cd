package com.codescribe.analyzer.static_analysis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collects the .java files of a project tree as {@link SourceUnit}s ordered by relative path.
 *
 * Hidden paths (any component starting with '.') and build output directories outside {@code src} are skipped.
 * Files that cannot be read or are not valid UTF-8 are skipped with a warning.
 */
public class ProjectSourceCollector {

    private static final Set<String> OUTPUT_DIRS = Set.of("target", "build", "out");

    public List<SourceUnit> collect(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new UncheckedIOException(new IOException("Not a directory: " + root));
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk
                .filter(p -> p.getFileName().toString().endsWith(".java"))
                .filter(Files::isRegularFile)
                .filter(p -> !isExcluded(root.relativize(p)))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not walk project tree: " + root, e);
        }

        List<SourceUnit> units = new ArrayList<>();
        for (Path file : files) {
            String relative = toPosix(root.relativize(file));
            try {
                units.add(new SourceUnit(relative, Files.readString(file)));
            } catch (IOException e) {
                // MalformedInputException for non-UTF-8 content lands here too
                System.err.println("[codescribe] Warning: skipping unreadable file " + relative + ": " + e);
            }
        }
        units.sort(Comparator.comparing(SourceUnit::path));
        return units;
    }

    private static boolean isExcluded(Path relative) {
        boolean insideSources = false;
        for (Path part : relative) {
            String name = part.toString();
            if (name.startsWith(".")) return true;
            // a package may legitimately be called "build"
            if (!insideSources && OUTPUT_DIRS.contains(name)) return true;
            if (name.equals("src")) insideSources = true;
        }
        return false;
    }

    private static String toPosix(Path relative) {
        List<String> parts = new ArrayList<>();
        relative.forEach(p -> parts.add(p.toString()));
        return String.join("/", parts);
    }
}
