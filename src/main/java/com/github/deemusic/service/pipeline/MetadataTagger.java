package com.github.deemusic.service.pipeline;

import com.github.deemusic.model.CatalogEntry;

import java.nio.file.Path;

public interface MetadataTagger {

    /**
     * Write title, artist, album and track number into the audio file.
     *
     * @throws com.github.deemusic.exception.TaggingException if the file could not be tagged
     */
    void embed(Path file, CatalogEntry metadata);
}
