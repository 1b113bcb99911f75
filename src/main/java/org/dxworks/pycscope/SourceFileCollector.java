package org.dxworks.pycscope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands command line operands into the Python source files to index, as
 * paths relative to the base directory.
 */
public class SourceFileCollector {
    private final Path basePath;
    private final boolean recurse;
    private final int maxFileLines;

    public SourceFileCollector(Path basePath, boolean recurse, int maxFileLines) {
        this.basePath = basePath;
        this.recurse = recurse;
        this.maxFileLines = maxFileLines;
    }

    public static boolean isPython(String name) {
        return name.endsWith(".py");
    }

    /**
     * Reads a source list file: one operand per line, trailing whitespace removed.
     */
    public static List<String> readSourceList(Path listFile) throws IOException {
        return Files.readAllLines(listFile, StandardCharsets.UTF_8).stream()
                .map(String::stripTrailing)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
    }

    public List<String> collect(List<String> operands) throws IOException {
        List<String> files = new ArrayList<>();
        for (String name : operands) {
            if (Files.isDirectory(basePath.resolve(name))) {
                collectDirectory(name, files);
            } else if (isPython(name)) {
                addIfWithinLimit(name, files);
            }
        }
        return files;
    }

    private void collectDirectory(String relativeDir, List<String> files) throws IOException {
        List<Path> entries;
        try (Stream<Path> stream = Files.list(basePath.resolve(relativeDir))) {
            entries = stream.sorted().collect(Collectors.toList());
        }
        for (Path entry : entries) {
            String relative = join(relativeDir, entry.getFileName().toString());
            if (Files.isDirectory(entry)) {
                if (recurse) {
                    collectDirectory(relative, files);
                }
            } else if (isPython(relative)) {
                addIfWithinLimit(relative, files);
            }
        }
    }

    private void addIfWithinLimit(String relative, List<String> files) {
        if (withinMaxLines(basePath.resolve(relative), maxFileLines)) {
            files.add(relative);
        } else {
            System.err.println("pycscope: " + relative + ": skipped, longer than " + maxFileLines + " lines");
        }
    }

    private static String join(String dir, String name) {
        return dir.endsWith("/") ? dir + name : dir + "/" + name;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable files are reported when they are indexed
            return true;
        }
    }
}
