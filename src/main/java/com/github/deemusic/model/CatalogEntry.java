package com.github.deemusic.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolved catalog metadata. Composite entries list their children in {@link #childIds};
 * track entries carry the stream locator and its key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogEntry {

    private String id;
    private ItemType type;
    private String title;
    private String artist;
    private String album;
    private Integer trackNumber;

    @Builder.Default
    private List<String> childIds = new ArrayList<>();

    private String streamLocator;
    private String streamKey;

    public boolean hasChildren() {
        return childIds != null && !childIds.isEmpty();
    }
}
