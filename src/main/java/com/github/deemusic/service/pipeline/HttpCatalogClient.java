package com.github.deemusic.service.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.deemusic.config.DeeMusicProperties;
import com.github.deemusic.exception.ContentUnavailableException;
import com.github.deemusic.exception.TransientDownloadException;
import com.github.deemusic.model.CatalogEntry;
import com.github.deemusic.model.ItemType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalog client for a JSON API laid out as {@code GET {base}/{type}/{id}}.
 *
 * <p>Expected body:
 * <pre>
 * {"id": "...", "title": "...", "artist": "...", "album": "...", "trackNumber": 3,
 *  "childIds": ["..."], "streamLocator": "https://...", "streamKey": "..."}
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpCatalogClient implements CatalogClient {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DeeMusicProperties properties;

    @Override
    public CatalogEntry resolve(ItemType type, String id) {
        HttpUrl base = HttpUrl.parse(properties.getCatalog().getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid catalog base URL: " + properties.getCatalog().getBaseUrl());
        }
        HttpUrl url = base.newBuilder()
                .addPathSegment(type.code())
                .addPathSegment(id)
                .build();

        log.debug("Resolving {} {} via {}", type.code(), id, url);
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw HttpFailures.forStatus(response.code(), type.code() + " " + id);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransientDownloadException("Empty catalog response for " + type.code() + " " + id);
            }
            return parse(type, id, objectMapper.readTree(body.string()));
        } catch (IOException e) {
            throw new TransientDownloadException(
                    "Catalog request failed for " + type.code() + " " + id + ": " + e.getMessage(), e);
        }
    }

    CatalogEntry parse(ItemType type, String id, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ContentUnavailableException("Malformed catalog entry for " + type.code() + " " + id);
        }

        List<String> childIds = new ArrayList<>();
        JsonNode children = node.path("childIds");
        if (children.isArray()) {
            children.forEach(child -> childIds.add(child.asText()));
        }

        return CatalogEntry.builder()
                .id(node.path("id").asText(id))
                .type(type)
                .title(text(node, "title"))
                .artist(text(node, "artist"))
                .album(text(node, "album"))
                .trackNumber(node.hasNonNull("trackNumber") ? node.get("trackNumber").asInt() : null)
                .childIds(childIds)
                .streamLocator(text(node, "streamLocator"))
                .streamKey(text(node, "streamKey"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
