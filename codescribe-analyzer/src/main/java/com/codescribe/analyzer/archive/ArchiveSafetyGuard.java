package com.codescribe.analyzer.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Extracts zip archives without letting any entry escape the destination directory.
 *
 * All entries are validated before the first byte is written: one bad entry rejects the whole archive.
 */
public class ArchiveSafetyGuard {

    /**
     * Validates every entry of {@code archive} against {@code destination} without writing anything.
     *
     * @throws TraversalViolationException if an entry would resolve outside the destination
     * @throws ArchiveReadException if the archive cannot be read
     */
    public void check(Path archive, Path destination) {
        Path root = root(destination);
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            targets(zip, root);
        } catch (IOException e) {
            throw new ArchiveReadException("Could not read archive " + archive + ": " + e.getMessage(), e);
        }
    }

    /**
     * Validates, then extracts every entry of {@code archive} under {@code destination}.
     *
     * @return number of files written
     * @throws TraversalViolationException if an entry would resolve outside the destination; nothing is written
     * @throws ArchiveReadException if the archive cannot be read or an entry cannot be written
     */
    public int extract(Path archive, Path destination) {
        Path root = root(destination);
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            List<Target> targets = targets(zip, root);
            Files.createDirectories(root);
            int written = 0;
            for (Target target : targets) {
                if (target.entry().isDirectory()) {
                    Files.createDirectories(target.path());
                    continue;
                }
                Files.createDirectories(target.path().getParent());
                try (InputStream in = zip.getInputStream(target.entry())) {
                    Files.copy(in, target.path(), StandardCopyOption.REPLACE_EXISTING);
                }
                written++;
            }
            System.err.println("[codescribe] Extracted " + written + " files to " + root);
            return written;
        } catch (IOException e) {
            throw new ArchiveReadException("Could not extract archive " + archive + ": " + e.getMessage(), e);
        }
    }

    private record Target(ZipEntry entry, Path path) {}

    private static List<Target> targets(ZipFile zip, Path root) {
        List<Target> targets = new ArrayList<>();
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            targets.add(new Target(entry, resolveInside(root, entry.getName())));
        }
        return targets;
    }

    static Path resolveInside(Path root, String entryName) {
        Path target;
        try {
            target = root.resolve(entryName).normalize();
        } catch (java.nio.file.InvalidPathException e) {
            throw new TraversalViolationException("Archive entry has an invalid path: " + entryName);
        }
        if (!target.startsWith(root) || target.equals(root) && !entryName.endsWith("/")) {
            throw new TraversalViolationException("Archive contains an unsafe path: " + entryName);
        }
        return target;
    }

    private static Path root(Path destination) {
        Path absolute = destination.toAbsolutePath().normalize();
        try {
            // follow a symlinked destination so the containment check compares real locations
            return Files.exists(absolute) ? absolute.toRealPath() : absolute;
        } catch (IOException e) {
            throw new ArchiveReadException("Could not resolve destination " + destination + ": " + e.getMessage(), e);
        }
    }

    public static class TraversalViolationException extends RuntimeException {
        public TraversalViolationException(String msg) { super(msg); }
    }

    public static class ArchiveReadException extends RuntimeException {
        public ArchiveReadException(String msg, Throwable cause) { super(msg, cause); }
    }
}
