package com.github.deemusic.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueueItem")
class QueueItemTest {

    private static QueueItem album(DownloadStatus status, int completed, int total) {
        return QueueItem.builder()
                .id("album-1")
                .type(ItemType.ALBUM)
                .title("Album")
                .status(status)
                .completedTracks(completed)
                .totalTracks(total)
                .build();
    }

    @Nested
    @DisplayName("isPartialSuccess")
    class PartialSuccessTests {

        @Test
        @DisplayName("should be false when total tracks is zero")
        void neverPartialWithoutTracks() {
            assertFalse(album(DownloadStatus.COMPLETED, 0, 0).isPartialSuccess());
        }

        @Test
        @DisplayName("should be false when every track completed")
        void neverPartialWhenAllCompleted() {
            assertFalse(album(DownloadStatus.COMPLETED, 10, 10).isPartialSuccess());
        }

        @Test
        @DisplayName("should be true when completed with missing tracks")
        void partialWhenSomeTracksMissing() {
            assertTrue(album(DownloadStatus.COMPLETED, 7, 10).isPartialSuccess());
        }

        @ParameterizedTest
        @EnumSource(value = DownloadStatus.class, names = "COMPLETED", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("should be false for any status other than completed")
        void neverPartialUnlessCompleted(DownloadStatus status) {
            assertFalse(album(status, 7, 10).isPartialSuccess());
        }
    }

    @Test
    @DisplayName("builder defaults should describe a fresh pending item")
    void builderDefaults() {
        QueueItem item = QueueItem.builder().id("t1").type(ItemType.TRACK).build();

        assertEquals(DownloadStatus.PENDING, item.getStatus());
        assertEquals(0, item.getProgress());
        assertEquals("", item.getErrorMessage());
        assertEquals(0, item.getRetryCount());
        assertEquals(AudioQuality.MP3_320, item.getQuality());
        assertFalse(item.isComposite());
    }

    @Test
    @DisplayName("copy should be independent of the original")
    void copyShouldBeIndependent() {
        QueueItem original = album(DownloadStatus.DOWNLOADING, 3, 10);
        QueueItem copy = original.copy();

        copy.setCompletedTracks(4);
        copy.setStatus(DownloadStatus.PAUSED);

        assertEquals(original.getId(), copy.getId());
        assertEquals(3, original.getCompletedTracks());
        assertEquals(DownloadStatus.DOWNLOADING, original.getStatus());
    }

    @Test
    @DisplayName("display name should include the artist when known")
    void displayName() {
        QueueItem track = QueueItem.builder().id("t1").type(ItemType.TRACK).title("Song").artist("Band").build();
        QueueItem artist = QueueItem.builder().id("a1").type(ItemType.ARTIST).title("Band").artist("Band").build();

        assertEquals("Band - Song", track.getDisplayName());
        assertEquals("Band", artist.getDisplayName());
    }

    @ParameterizedTest
    @EnumSource(ItemType.class)
    @DisplayName("type codes should round-trip")
    void typeCodesRoundTrip(ItemType type) {
        assertEquals(type, ItemType.fromCode(type.code()));
    }
}
