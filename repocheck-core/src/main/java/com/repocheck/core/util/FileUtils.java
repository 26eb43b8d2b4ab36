package com.repocheck.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists the regular files directly inside a directory whose name ends with the given suffix.
     *
     * <p>Subdirectories are not descended into. Results are sorted by file name so that
     * callers iterate in a stable order.
     *
     * @param directory directory to list
     * @param suffix file name suffix (e.g., ".py"), or empty string for all files
     * @return matching paths sorted by file name
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> listFiles(Path directory, String suffix) throws IOException {
        try (Stream<Path> paths = Files.list(directory)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(suffix))
                .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                .toList();
        }
    }

    /**
     * Reads a file as a string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path);
    }

    /**
     * Checks if a path is a directory.
     *
     * @param path path to check
     * @return true if path is a directory
     */
    public static boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return file name up to the last dot, or the whole name if there is no extension
     */
    public static String stem(Path path) {
        return stem(path.getFileName().toString());
    }

    /**
     * Gets a file name without its extension.
     *
     * @param fileName file name
     * @return file name up to the last dot, or the whole name if there is no extension
     */
    public static String stem(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
