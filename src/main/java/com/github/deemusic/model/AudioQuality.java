package com.github.deemusic.model;

public enum AudioQuality {
    MP3_128("MP3 128kbps", "mp3"),
    MP3_320("MP3 320kbps", "mp3"),
    FLAC("FLAC", "flac");

    private final String displayName;
    private final String extension;

    AudioQuality(String displayName, String extension) {
        this.displayName = displayName;
        this.extension = extension;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getExtension() {
        return extension;
    }
}
