package com.github.deemusic.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Utility class for file path operations and filename sanitization.
 */
@Slf4j
@UtilityClass
public class PathUtils {

    /**
     * Make a catalog name safe to use as a single path segment.
     *
     * @param filename Original name
     * @return Sanitized name, or "Unknown" if nothing usable is left
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Unknown";
        }

        String sanitized = filename
                .replaceAll("[<>:\"/\\\\|?*\\x00-\\x1F]", "_")  // Invalid filesystem characters
                .replaceAll("\\s+", " ")                        // Collapse whitespace
                .trim()
                .replaceAll("[. ]+$", "");                      // Windows rejects trailing dots and spaces

        if (sanitized.length() > DownloadConstants.MAX_FILENAME_LENGTH) {
            sanitized = sanitized.substring(0, DownloadConstants.MAX_FILENAME_LENGTH).trim();
        }
        return sanitized.isEmpty() ? "Unknown" : sanitized;
    }

    /**
     * Create directory structure if it doesn't exist.
     *
     * @param path Directory path to create
     * @throws IOException if the directories cannot be created
     */
    public static void createDirectoryStructure(Path path) throws IOException {
        if (!Files.exists(path)) {
            Files.createDirectories(path);
            log.debug("Created directory structure: {}", path);
        }
    }

    /**
     * Build file path with proper separators. Blank segments are skipped.
     *
     * @param basePath Base directory path
     * @param segments Path segments to append
     * @return Complete path
     */
    public static Path buildPath(String basePath, String... segments) {
        Path path = Paths.get(basePath);
        for (String segment : segments) {
            if (segment != null && !segment.isBlank()) {
                path = path.resolve(segment);
            }
        }
        return path;
    }

    /**
     * Ensure path ends with specific extension.
     *
     * @param filename Original filename
     * @param extension Desired extension (with or without leading dot)
     * @return Filename with correct extension
     */
    public static String ensureExtension(String filename, String extension) {
        if (filename == null || filename.isBlank()) {
            return "Unknown" + normalizeExtension(extension);
        }

        String normalizedExt = normalizeExtension(extension);

        if (filename.toLowerCase().endsWith(normalizedExt.toLowerCase())) {
            return filename;
        }

        return filename + normalizedExt;
    }

    private static String normalizeExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return "";
        }
        return extension.startsWith(".") ? extension : "." + extension;
    }

    /**
     * Sibling of {@code target} used while the file is still being written.
     */
    public static Path partFileFor(Path target) {
        return target.resolveSibling(target.getFileName() + DownloadConstants.PART_FILE_SUFFIX);
    }
}
