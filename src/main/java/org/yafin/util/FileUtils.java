package org.yafin.util;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File system helpers for walking the input tree and managing the output area.
 */
public final class FileUtils {

    private FileUtils() {
    }

    /**
     * Lists all regular files below {@code rootDir}, recursively, in path order.
     */
    public static List<Path> findFiles(Path rootDir) throws IOException {
        if (!Files.isDirectory(rootDir)) throw new IOException("Base dir not found: " + rootDir);
        try (Stream<Path> paths = Files.walk(rootDir)) {
            return paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    /**
     * Lower-cased extension including the dot, or an empty string.
     */
    public static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Relative path with '/' separators and without the file extension.
     */
    public static String baseName(Path relativePath) {
        String rel = relativePath.toString().replace('\\', '/');
        int slash = rel.lastIndexOf('/');
        int dot = rel.lastIndexOf('.');
        return dot > slash + 1 ? rel.substring(0, dot) : rel;
    }

    /**
     * Deletes a file or a directory tree; does nothing when the path does not exist.
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) return;
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) throw exc;
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
