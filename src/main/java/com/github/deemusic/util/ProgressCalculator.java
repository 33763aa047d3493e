package com.github.deemusic.util;

import lombok.experimental.UtilityClass;

/**
 * Percentages, speed and ETA for downloads. All percentages are integers clamped to 0..100.
 */
@UtilityClass
public class ProgressCalculator {

    /**
     * Calculate download speed in bytes per second.
     *
     * @param downloadedBytes Total bytes downloaded so far
     * @param elapsedMillis Time elapsed since download started
     * @return Speed in bytes per second, or null if calculation not possible
     */
    public static Double calculateSpeed(long downloadedBytes, long elapsedMillis) {
        if (elapsedMillis <= 0 || downloadedBytes <= 0) {
            return null;
        }
        return downloadedBytes * 1000.0 / elapsedMillis;
    }

    /**
     * Calculate ETA (estimated time remaining) in seconds.
     *
     * @return ETA in seconds, or null if calculation not possible
     */
    public static Long calculateEta(long downloadedBytes, long totalBytes, long elapsedMillis) {
        if (totalBytes <= 0 || downloadedBytes <= 0 || elapsedMillis <= 0) {
            return null;
        }

        long remainingBytes = totalBytes - downloadedBytes;
        if (remainingBytes <= 0) {
            return 0L;
        }

        double bytesPerMilli = (double) downloadedBytes / elapsedMillis;
        return (long) (remainingBytes / bytesPerMilli / 1000.0);
    }

    /**
     * Transfer percentage of a single stream, rounded down so 100 is only reported once
     * every byte has arrived.
     *
     * @return 0..100, or 0 when the total size is unknown
     */
    public static int transferPercent(long downloadedBytes, long totalBytes) {
        if (totalBytes <= 0 || downloadedBytes <= 0) {
            return 0;
        }
        if (downloadedBytes >= totalBytes) {
            return 100;
        }
        return clamp((int) ((downloadedBytes * 100L) / totalBytes));
    }

    /**
     * {@code round(100 * completed / total)}, or 0 when total is not known yet.
     */
    public static int compositePercent(int completed, int total) {
        if (total <= 0 || completed <= 0) {
            return 0;
        }
        return clamp((int) Math.round(100.0 * Math.min(completed, total) / total));
    }

    public static int clamp(int percent) {
        return Math.max(0, Math.min(100, percent));
    }
}
