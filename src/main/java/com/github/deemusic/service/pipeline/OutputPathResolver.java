package com.github.deemusic.service.pipeline;

import com.github.deemusic.config.DeeMusicProperties;
import com.github.deemusic.model.AudioQuality;
import com.github.deemusic.model.CatalogEntry;
import com.github.deemusic.model.ItemType;
import com.github.deemusic.model.QueueItem;
import com.github.deemusic.util.DownloadConstants;
import com.github.deemusic.util.PathUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Where a track ends up on disk.
 * <ul>
 *   <li>{@code {outputDir}/{artist}/{album}/{NN} - {title}.{ext}} for tracks, albums and artists</li>
 *   <li>{@code {outputDir}/Playlists/{playlist}/{NN} - {artist} - {title}.{ext}} for playlist children</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class OutputPathResolver {

    private final DeeMusicProperties properties;

    /**
     * @param track    resolved track
     * @param owner    queue item the track is downloaded for
     * @param position 1-based position inside the owner, used when the track carries no number
     */
    public Path resolve(CatalogEntry track, QueueItem owner, int position, AudioQuality quality) {
        String root = properties.getDownload().getOutputDir();
        int number = track.getTrackNumber() != null && track.getTrackNumber() > 0 ? track.getTrackNumber() : position;

        if (owner.getType() == ItemType.PLAYLIST) {
            String name = String.format("%02d - %s - %s", position, track.getArtist(), track.getTitle());
            return PathUtils.buildPath(root,
                    DownloadConstants.PLAYLISTS_DIRECTORY,
                    PathUtils.sanitizeFilename(owner.getTitle()),
                    PathUtils.ensureExtension(PathUtils.sanitizeFilename(name), quality.getExtension()));
        }

        String name = number > 0
                ? String.format("%02d - %s", number, track.getTitle())
                : track.getTitle();
        return PathUtils.buildPath(root,
                PathUtils.sanitizeFilename(track.getArtist()),
                PathUtils.sanitizeFilename(track.getAlbum()),
                PathUtils.ensureExtension(PathUtils.sanitizeFilename(name), quality.getExtension()));
    }

    /**
     * Directory that holds every track of a composite item.
     */
    public Path containerDirectory(QueueItem owner) {
        String root = properties.getDownload().getOutputDir();
        if (owner.getType() == ItemType.PLAYLIST) {
            return PathUtils.buildPath(root, DownloadConstants.PLAYLISTS_DIRECTORY,
                    PathUtils.sanitizeFilename(owner.getTitle()));
        }
        if (owner.getType() == ItemType.ARTIST) {
            return PathUtils.buildPath(root, PathUtils.sanitizeFilename(owner.getTitle()));
        }
        return PathUtils.buildPath(root,
                PathUtils.sanitizeFilename(owner.getArtist()),
                PathUtils.sanitizeFilename(owner.getAlbum() != null ? owner.getAlbum() : owner.getTitle()));
    }
}
