package com.github.deemusic.service;

import com.github.deemusic.exception.ContentUnavailableException;
import com.github.deemusic.model.CatalogEntry;
import com.github.deemusic.model.ItemType;
import com.github.deemusic.service.pipeline.CatalogClient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory catalog. Unknown ids resolve to {@link ContentUnavailableException}.
 */
class FakeCatalogClient implements CatalogClient {

    private final Map<String, CatalogEntry> entries = new ConcurrentHashMap<>();

    FakeCatalogClient track(String id) {
        entries.put(id, CatalogEntry.builder()
                .id(id)
                .type(ItemType.TRACK)
                .title("Song " + id)
                .artist("Artist")
                .album("Record")
                .streamLocator("https://cdn.test/" + id)
                .build());
        return this;
    }

    FakeCatalogClient album(String id, String... childIds) {
        for (String childId : childIds) {
            track(childId);
        }
        entries.put(id, CatalogEntry.builder()
                .id(id)
                .type(ItemType.ALBUM)
                .title("Record")
                .artist("Artist")
                .childIds(new ArrayList<>(Arrays.asList(childIds)))
                .build());
        return this;
    }

    static String[] trackIds(String prefix, int count) {
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            ids.add(prefix + i);
        }
        return ids.toArray(new String[0]);
    }

    @Override
    public CatalogEntry resolve(ItemType type, String id) {
        CatalogEntry entry = entries.get(id);
        if (entry == null) {
            throw new ContentUnavailableException("Unknown " + type.code() + " " + id);
        }
        CatalogEntry copy = CatalogEntry.builder()
                .id(entry.getId())
                .type(entry.getType())
                .title(entry.getTitle())
                .artist(entry.getArtist())
                .album(entry.getAlbum())
                .trackNumber(entry.getTrackNumber())
                .childIds(new ArrayList<>(entry.getChildIds()))
                .streamLocator(entry.getStreamLocator())
                .streamKey(entry.getStreamKey())
                .build();
        return copy;
    }
}
