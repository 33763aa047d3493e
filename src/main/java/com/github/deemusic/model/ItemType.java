package com.github.deemusic.model;

public enum ItemType {
    TRACK("Track", false),
    ALBUM("Album", true),
    PLAYLIST("Playlist", true),
    ARTIST("Artist", true);

    private final String displayName;
    private final boolean composite;

    ItemType(String displayName, boolean composite) {
        this.displayName = displayName;
        this.composite = composite;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Composite items are decomposed into child tracks when they run.
     */
    public boolean isComposite() {
        return composite;
    }

    public String code() {
        return name().toLowerCase();
    }

    public static ItemType fromCode(String code) {
        return valueOf(code.toUpperCase());
    }
}
