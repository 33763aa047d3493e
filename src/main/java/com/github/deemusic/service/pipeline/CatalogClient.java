package com.github.deemusic.service.pipeline;

import com.github.deemusic.model.CatalogEntry;
import com.github.deemusic.model.ItemType;

/**
 * Resolves catalog identifiers into metadata, child ids and stream locations.
 *
 * <p>Implementations report failures with
 * {@link com.github.deemusic.exception.ContentUnavailableException},
 * {@link com.github.deemusic.exception.AuthenticationException} or
 * {@link com.github.deemusic.exception.TransientDownloadException}.
 */
public interface CatalogClient {

    CatalogEntry resolve(ItemType type, String id);
}
