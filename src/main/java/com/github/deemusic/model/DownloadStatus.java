package com.github.deemusic.model;

public enum DownloadStatus {
    PENDING("Pending"),
    DOWNLOADING("Downloading"),
    PAUSED("Paused"),
    COMPLETED("Completed"),
    FAILED("Failed");

    private final String displayName;

    DownloadStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Value stored in the {@code status} column.
     */
    public String code() {
        return name().toLowerCase();
    }

    public static DownloadStatus fromCode(String code) {
        return valueOf(code.toUpperCase());
    }
}
