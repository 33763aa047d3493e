package com.github.deemusic.service.pipeline;

import com.github.deemusic.exception.ContentUnavailableException;
import com.github.deemusic.exception.DiskException;
import com.github.deemusic.model.AudioQuality;
import com.github.deemusic.model.CatalogEntry;
import com.github.deemusic.model.DownloadResult;
import com.github.deemusic.util.FormatUtils;
import com.github.deemusic.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Fetch, decrypt and tag one resolved track into {@code target}.
 *
 * <p>The stream is written to a {@code .part} sibling and moved into place once complete,
 * so a file at {@code target} is always whole. An existing non-empty target is reused.
 * Tagging failures are logged and reported through {@link DownloadResult#isTagged()}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackDownloader {

    private final StreamFetcher streamFetcher;
    private final MetadataTagger metadataTagger;

    public DownloadResult download(CatalogEntry track, Path target, AudioQuality quality, TransferListener listener) {
        if (track.getStreamLocator() == null || track.getStreamLocator().isBlank()) {
            throw new ContentUnavailableException("No stream available for track " + track.getId());
        }

        long existing = existingSize(target);
        if (existing > 0) {
            log.info("Track {} already on disk at {}", track.getId(), target);
            listener.onProgress(existing, existing);
            return DownloadResult.builder()
                    .trackId(track.getId())
                    .filePath(target)
                    .fileSizeBytes(existing)
                    .quality(quality)
                    .tagged(false)
                    .build();
        }

        try {
            PathUtils.createDirectoryStructure(target.getParent());
        } catch (IOException e) {
            throw new DiskException("Cannot create " + target.getParent() + ": " + e.getMessage(), e);
        }

        Path partFile = PathUtils.partFileFor(target);
        long started = System.currentTimeMillis();
        try {
            streamFetcher.fetch(track.getStreamLocator(), track.getStreamKey(), partFile, listener);
            moveIntoPlace(partFile, target);
        } finally {
            deletePartFile(partFile);
        }

        long size = existingSize(target);
        log.info("Downloaded {} ({}) in {}", target.getFileName(), FormatUtils.formatSize(size),
                FormatUtils.formatElapsed(System.currentTimeMillis() - started));

        return DownloadResult.builder()
                .trackId(track.getId())
                .filePath(target)
                .fileSizeBytes(size)
                .quality(quality)
                .tagged(tag(target, track))
                .build();
    }

    private boolean tag(Path file, CatalogEntry track) {
        try {
            metadataTagger.embed(file, track);
            return true;
        } catch (RuntimeException e) {
            log.warn("Tagging failed for track {}: {}", track.getId(), e.getMessage());
            return false;
        }
    }

    private void moveIntoPlace(Path partFile, Path target) {
        try {
            try {
                Files.move(partFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new DiskException("Cannot move " + partFile + " into place: " + e.getMessage(), e);
        }
    }

    private void deletePartFile(Path partFile) {
        try {
            Files.deleteIfExists(partFile);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", partFile, e.getMessage());
        }
    }

    private static long existingSize(Path file) {
        try {
            return Files.isRegularFile(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            return 0L;
        }
    }
}
