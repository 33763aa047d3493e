package com.github.deemusic.service.pipeline;

import com.github.deemusic.exception.TaggingException;
import com.github.deemusic.model.CatalogEntry;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Slf4j
@Component
public class JaudiotaggerMetadataTagger implements MetadataTagger {

    @Override
    public void embed(Path file, CatalogEntry metadata) {
        try {
            AudioFile audioFile = AudioFileIO.read(file.toFile());
            Tag tag = audioFile.getTagOrCreateAndSetDefault();

            setIfPresent(tag, FieldKey.TITLE, metadata.getTitle());
            setIfPresent(tag, FieldKey.ARTIST, metadata.getArtist());
            setIfPresent(tag, FieldKey.ALBUM, metadata.getAlbum());
            if (metadata.getTrackNumber() != null && metadata.getTrackNumber() > 0) {
                tag.setField(FieldKey.TRACK, String.valueOf(metadata.getTrackNumber()));
            }

            audioFile.commit();
            log.debug("Tagged {}", file.getFileName());
        } catch (Exception e) {
            throw new TaggingException("Could not tag " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private void setIfPresent(Tag tag, FieldKey key, String value) throws Exception {
        if (value != null && !value.isBlank()) {
            tag.setField(key, value.trim());
        }
    }
}
