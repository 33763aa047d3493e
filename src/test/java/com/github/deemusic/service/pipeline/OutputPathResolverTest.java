package com.github.deemusic.service.pipeline;

import com.github.deemusic.config.DeeMusicProperties;
import com.github.deemusic.model.AudioQuality;
import com.github.deemusic.model.CatalogEntry;
import com.github.deemusic.model.ItemType;
import com.github.deemusic.model.QueueItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OutputPathResolver")
class OutputPathResolverTest {

    private OutputPathResolver resolver;

    @BeforeEach
    void setUp() {
        DeeMusicProperties properties = new DeeMusicProperties();
        properties.getDownload().setOutputDir("/music");
        resolver = new OutputPathResolver(properties);
    }

    private static CatalogEntry track(Integer number) {
        return CatalogEntry.builder()
                .id("1")
                .type(ItemType.TRACK)
                .title("One More Time")
                .artist("Daft Punk")
                .album("Discovery")
                .trackNumber(number)
                .build();
    }

    private static QueueItem owner(ItemType type, String title) {
        return QueueItem.builder().id("o").type(type).title(title).artist("Daft Punk").album("Discovery").build();
    }

    @Nested
    @DisplayName("track files")
    class TrackFileTests {

        @Test
        @DisplayName("should use artist, album and track number")
        void albumLayout() {
            Path path = resolver.resolve(track(1), owner(ItemType.ALBUM, "Discovery"), 5, AudioQuality.MP3_320);

            assertEquals(Paths.get("/music", "Daft Punk", "Discovery", "01 - One More Time.mp3"), path);
        }

        @Test
        @DisplayName("should fall back to the position when the track has no number")
        void positionFallback() {
            Path path = resolver.resolve(track(null), owner(ItemType.ALBUM, "Discovery"), 7, AudioQuality.FLAC);

            assertEquals(Paths.get("/music", "Daft Punk", "Discovery", "07 - One More Time.flac"), path);
        }

        @Test
        @DisplayName("a single track without a number should have a plain name")
        void singleTrack() {
            Path path = resolver.resolve(track(null), owner(ItemType.TRACK, "One More Time"), 0, AudioQuality.MP3_128);

            assertEquals(Paths.get("/music", "Daft Punk", "Discovery", "One More Time.mp3"), path);
        }

        @Test
        @DisplayName("playlist children should go under the playlist with the artist in the name")
        void playlistLayout() {
            Path path = resolver.resolve(track(9), owner(ItemType.PLAYLIST, "Road Trip"), 3, AudioQuality.MP3_320);

            assertEquals(Paths.get("/music", "Playlists", "Road Trip", "03 - Daft Punk - One More Time.mp3"), path);
        }

        @Test
        @DisplayName("should sanitize every segment")
        void sanitizes() {
            CatalogEntry entry = track(2);
            entry.setArtist("AC/DC");
            entry.setAlbum(null);

            Path path = resolver.resolve(entry, owner(ItemType.ALBUM, "x"), 2, AudioQuality.MP3_320);

            assertEquals(Paths.get("/music", "AC_DC", "Unknown", "02 - One More Time.mp3"), path);
        }
    }

    @Nested
    @DisplayName("container directories")
    class ContainerTests {

        @Test
        @DisplayName("album items should use artist and album")
        void album() {
            assertEquals(Paths.get("/music", "Daft Punk", "Discovery"),
                    resolver.containerDirectory(owner(ItemType.ALBUM, "Discovery")));
        }

        @Test
        @DisplayName("playlists should live under the playlists directory")
        void playlist() {
            assertEquals(Paths.get("/music", "Playlists", "Road Trip"),
                    resolver.containerDirectory(owner(ItemType.PLAYLIST, "Road Trip")));
        }

        @Test
        @DisplayName("artists should use the artist name")
        void artist() {
            assertEquals(Paths.get("/music", "Daft Punk"),
                    resolver.containerDirectory(owner(ItemType.ARTIST, "Daft Punk")));
        }
    }
}
