package com.github.deemusic.util;

import lombok.experimental.UtilityClass;

/**
 * Utility class for formatting data sizes, speeds and durations in log lines.
 */
@UtilityClass
public class FormatUtils {

    /**
     * Format bytes per second to human-readable speed string.
     *
     * @param bytesPerSecond Speed in bytes per second
     * @return Formatted string like "5.23 MB/s", "128.45 KB/s", or "512 B/s"
     */
    public static String formatSpeed(double bytesPerSecond) {
        if (bytesPerSecond >= 1_000_000_000) {
            return String.format("%.2f GB/s", bytesPerSecond / 1_000_000_000);
        } else if (bytesPerSecond >= 1_000_000) {
            return String.format("%.2f MB/s", bytesPerSecond / 1_000_000);
        } else if (bytesPerSecond >= 1_000) {
            return String.format("%.2f KB/s", bytesPerSecond / 1_000);
        } else {
            return String.format("%.0f B/s", bytesPerSecond);
        }
    }

    /**
     * Format bytes to human-readable size string.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.23 GB", "456.78 MB", or "789 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= 1_000_000_000) {
            return String.format("%.2f GB", bytes / 1_000_000_000.0);
        } else if (bytes >= 1_000_000) {
            return String.format("%.2f MB", bytes / 1_000_000.0);
        } else if (bytes >= 1_000) {
            return String.format("%.2f KB", bytes / 1_000.0);
        } else {
            return String.format("%d B", bytes);
        }
    }

    /**
     * Format a duration in milliseconds, e.g. "2m 5s" or "850ms".
     */
    public static String formatElapsed(long millis) {
        if (millis < 0) {
            return "0ms";
        }
        if (millis < 1000) {
            return millis + "ms";
        }

        long seconds = millis / 1000;
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else {
            return String.format("%ds", secs);
        }
    }
}
