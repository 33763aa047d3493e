package com.github.deemusic.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Display metadata known at enqueue time. Missing fields are filled in when the item is resolved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemHints {

    private String title;
    private String artist;
    private String album;
    private Integer totalTracks;
    private AudioQuality quality;

    public static ItemHints empty() {
        return new ItemHints();
    }
}
