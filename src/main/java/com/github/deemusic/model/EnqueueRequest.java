package com.github.deemusic.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueRequest {

    @NotBlank
    @Size(max = 128)
    private String id;

    @NotNull
    private ItemType type;

    private String title;
    private String artist;
    private String album;

    @Min(0)
    private Integer totalTracks;

    private AudioQuality quality;

    public ItemHints toHints() {
        return ItemHints.builder()
                .title(title)
                .artist(artist)
                .album(album)
                .totalTracks(totalTracks)
                .quality(quality)
                .build();
    }
}
