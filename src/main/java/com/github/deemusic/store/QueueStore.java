package com.github.deemusic.store;

import com.github.deemusic.exception.DuplicateItemException;
import com.github.deemusic.exception.ItemNotFoundException;
import com.github.deemusic.model.AudioQuality;
import com.github.deemusic.model.ChildTrack;
import com.github.deemusic.model.DownloadStatus;
import com.github.deemusic.model.HistoryRecord;
import com.github.deemusic.model.ItemType;
import com.github.deemusic.model.QueueItem;
import com.github.deemusic.model.QueueStats;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Durable queue of {@link QueueItem}s plus the download history log and per-child outcomes
 * of composite items.
 *
 * <p>Every mutation of a row happens while holding that id's lock, and {@code updated_at}
 * strictly increases with each write. Status changes that may race with a worker are
 * conditional on the expected status ({@link #updateIf}), which is also how a worker claims
 * a pending item.
 */
@Slf4j
@Repository
public class QueueStore {

    static final int MAX_ERROR_LENGTH = 4000;
    private static final int CLAIM_BATCH_SIZE = 8;

    private static final String ITEM_COLUMNS =
            "id, type, title, artist, album, status, progress, download_url, output_path, error_message,"
                    + " retry_count, total_tracks, completed_tracks, quality, created_at, updated_at,"
                    + " completed_at, available_at";

    private static final String INSERT_ITEM =
            "INSERT INTO queue_items (" + ITEM_COLUMNS + ")"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_ITEM =
            "UPDATE queue_items SET title = ?, artist = ?, album = ?, status = ?, progress = ?,"
                    + " download_url = ?, output_path = ?, error_message = ?, retry_count = ?,"
                    + " total_tracks = ?, completed_tracks = ?, quality = ?, updated_at = ?,"
                    + " completed_at = ?, available_at = ?"
                    + " WHERE id = ?";

    private static final String ORDER_BY_CREATED = " ORDER BY created_at ASC, id ASC";

    private static final RowMapper<QueueItem> ITEM_ROW_MAPPER = (rs, rowNum) -> QueueItem.builder()
            .id(rs.getString("id"))
            .type(ItemType.fromCode(rs.getString("type")))
            .title(rs.getString("title"))
            .artist(rs.getString("artist"))
            .album(rs.getString("album"))
            .status(DownloadStatus.fromCode(rs.getString("status")))
            .progress(rs.getInt("progress"))
            .downloadUrl(rs.getString("download_url"))
            .outputPath(rs.getString("output_path"))
            .errorMessage(nullToEmpty(rs.getString("error_message")))
            .retryCount(rs.getInt("retry_count"))
            .totalTracks(rs.getInt("total_tracks"))
            .completedTracks(rs.getInt("completed_tracks"))
            .quality(readQuality(rs, "quality"))
            .createdAt(readInstant(rs, "created_at"))
            .updatedAt(readInstant(rs, "updated_at"))
            .completedAt(readInstant(rs, "completed_at"))
            .availableAt(readInstant(rs, "available_at"))
            .build();

    private static final RowMapper<HistoryRecord> HISTORY_ROW_MAPPER = (rs, rowNum) -> HistoryRecord.builder()
            .id(rs.getLong("id"))
            .trackId(rs.getString("track_id"))
            .title(rs.getString("title"))
            .artist(rs.getString("artist"))
            .album(rs.getString("album"))
            .filePath(rs.getString("file_path"))
            .fileSizeBytes(rs.getLong("file_size"))
            .quality(readQuality(rs, "quality"))
            .downloadedAt(readInstant(rs, "downloaded_at"))
            .build();

    private static final RowMapper<ChildTrack> CHILD_ROW_MAPPER = (rs, rowNum) -> ChildTrack.builder()
            .parentId(rs.getString("parent_id"))
            .trackId(rs.getString("track_id"))
            .title(rs.getString("title"))
            .artist(rs.getString("artist"))
            .status(DownloadStatus.fromCode(rs.getString("status")))
            .errorMessage(nullToEmpty(rs.getString("error_message")))
            .attempts(rs.getInt("attempts"))
            .filePath(rs.getString("file_path"))
            .fileSizeBytes(rs.getLong("file_size"))
            .updatedAt(readInstant(rs, "updated_at"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final StripedLocks locks = new StripedLocks(64);

    /**
     * The migrator is taken as a constructor argument so the schema exists before the first query.
     */
    public QueueStore(JdbcTemplate jdbcTemplate, Clock clock, SchemaMigrator schemaMigrator) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        log.debug("Queue store ready at schema version {}", schemaMigrator.currentVersion());
    }

    // ---------------------------------------------------------------- items

    /**
     * Persist a new item. Status defaults to pending and both timestamps to now.
     *
     * @return the stored item, equal to what {@link #getById} returns afterwards
     * @throws DuplicateItemException if the id is already queued
     */
    public QueueItem add(@NonNull QueueItem item) {
        QueueItem stored = item.copy();
        Instant now = now();
        if (stored.getStatus() == null) {
            stored.setStatus(DownloadStatus.PENDING);
        }
        if (stored.getErrorMessage() == null) {
            stored.setErrorMessage("");
        }
        if (stored.getQuality() == null) {
            stored.setQuality(AudioQuality.MP3_320);
        }
        stored.setErrorMessage(truncateError(stored.getErrorMessage()));
        stored.setCreatedAt(stored.getCreatedAt() != null ? micros(stored.getCreatedAt()) : now);
        stored.setUpdatedAt(stored.getCreatedAt());
        stored.setCompletedAt(micros(stored.getCompletedAt()));
        stored.setAvailableAt(micros(stored.getAvailableAt()));

        ReentrantLock lock = locks.forKey(stored.getId());
        lock.lock();
        try {
            jdbcTemplate.update(INSERT_ITEM,
                    stored.getId(),
                    stored.getType().code(),
                    stored.getTitle(),
                    stored.getArtist(),
                    stored.getAlbum(),
                    stored.getStatus().code(),
                    stored.getProgress(),
                    stored.getDownloadUrl(),
                    stored.getOutputPath(),
                    stored.getErrorMessage(),
                    stored.getRetryCount(),
                    stored.getTotalTracks(),
                    stored.getCompletedTracks(),
                    stored.getQuality().name(),
                    timestamp(stored.getCreatedAt()),
                    timestamp(stored.getUpdatedAt()),
                    timestamp(stored.getCompletedAt()),
                    timestamp(stored.getAvailableAt()));
        } catch (DuplicateKeyException e) {
            throw new DuplicateItemException(stored.getId());
        } finally {
            lock.unlock();
        }

        log.debug("Stored item {} ({})", stored.getId(), stored.getStatus().code());
        return stored;
    }

    /**
     * Overwrite the mutable fields of an existing item and bump {@code updatedAt}.
     *
     * @return the stored item
     * @throws ItemNotFoundException if the id is not queued
     */
    public QueueItem update(@NonNull QueueItem item) {
        ReentrantLock lock = locks.forKey(item.getId());
        lock.lock();
        try {
            QueueItem current = findById(item.getId())
                    .orElseThrow(() -> new ItemNotFoundException(item.getId()));
            QueueItem stored = item.copy();
            stored.setCreatedAt(current.getCreatedAt());
            if (!write(stored, current.getUpdatedAt())) {
                throw new ItemNotFoundException(item.getId());
            }
            return stored;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply {@code change} to the item only if it currently has status {@code expected}.
     * The read, the check and the write happen under the item's lock.
     *
     * @return the stored item, or empty if the item is absent or in another status
     */
    public Optional<QueueItem> updateIf(@NonNull String id, @NonNull DownloadStatus expected,
                                        @NonNull Consumer<QueueItem> change) {
        return updateIf(id, expected, null, change);
    }

    /**
     * Like {@link #updateIf(String, DownloadStatus, Consumer)}, but also requires the row to be the
     * one created at {@code createdAt}. A row removed and queued again under the same id does not
     * match. A null {@code createdAt} matches any row.
     */
    public Optional<QueueItem> updateIf(@NonNull String id, @NonNull DownloadStatus expected, Instant createdAt,
                                        @NonNull Consumer<QueueItem> change) {
        ReentrantLock lock = locks.forKey(id);
        lock.lock();
        try {
            Optional<QueueItem> current = findById(id);
            if (current.isEmpty() || current.get().getStatus() != expected
                    || !sameRow(current.get(), createdAt)) {
                return Optional.empty();
            }
            QueueItem stored = current.get().copy();
            change.accept(stored);
            stored.setId(id);
            stored.setCreatedAt(current.get().getCreatedAt());
            return write(stored, current.get().getUpdatedAt()) ? Optional.of(stored) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public Optional<QueueItem> findById(@NonNull String id) {
        List<QueueItem> rows = jdbcTemplate.query(
                "SELECT " + ITEM_COLUMNS + " FROM queue_items WHERE id = ?", ITEM_ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * @throws ItemNotFoundException if the id is not queued
     */
    public QueueItem getById(@NonNull String id) {
        return findById(id).orElseThrow(() -> new ItemNotFoundException(id));
    }

    public List<QueueItem> getAll(int offset, int limit) {
        return jdbcTemplate.query(
                "SELECT " + ITEM_COLUMNS + " FROM queue_items" + ORDER_BY_CREATED + " LIMIT ? OFFSET ?",
                ITEM_ROW_MAPPER, limit, offset);
    }

    public List<QueueItem> getByStatus(@NonNull DownloadStatus status, int offset, int limit) {
        return jdbcTemplate.query(
                "SELECT " + ITEM_COLUMNS + " FROM queue_items WHERE status = ?" + ORDER_BY_CREATED
                        + " LIMIT ? OFFSET ?",
                ITEM_ROW_MAPPER, status.code(), limit, offset);
    }

    /**
     * Counts per status, aggregated in the database.
     */
    public QueueStats getStats() {
        return jdbcTemplate.queryForObject(
                "SELECT"
                        + " COALESCE(SUM(CASE WHEN status = 'pending' THEN 1 ELSE 0 END), 0) AS pending,"
                        + " COALESCE(SUM(CASE WHEN status = 'downloading' THEN 1 ELSE 0 END), 0) AS downloading,"
                        + " COALESCE(SUM(CASE WHEN status = 'paused' THEN 1 ELSE 0 END), 0) AS paused,"
                        + " COALESCE(SUM(CASE WHEN status = 'completed' THEN 1 ELSE 0 END), 0) AS completed,"
                        + " COALESCE(SUM(CASE WHEN status = 'failed' THEN 1 ELSE 0 END), 0) AS failed"
                        + " FROM queue_items",
                (rs, rowNum) -> QueueStats.builder()
                        .pending(rs.getLong("pending"))
                        .downloading(rs.getLong("downloading"))
                        .paused(rs.getLong("paused"))
                        .completed(rs.getLong("completed"))
                        .failed(rs.getLong("failed"))
                        .build());
    }

    public int countByStatus(@NonNull DownloadStatus status) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM queue_items WHERE status = ?", Integer.class, status.code());
        return count != null ? count : 0;
    }

    /**
     * @return true if a row was deleted
     */
    public boolean delete(@NonNull String id) {
        ReentrantLock lock = locks.forKey(id);
        lock.lock();
        try {
            return jdbcTemplate.update("DELETE FROM queue_items WHERE id = ?", id) > 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claim the oldest claimable pending item by moving it to downloading.
     * Pending items are ordered by {@code updatedAt}, so requeued items wait behind the rest.
     *
     * @return the claimed item, or empty if nothing is claimable right now
     */
    public Optional<QueueItem> claimNextPending() {
        while (true) {
            List<String> candidates = jdbcTemplate.queryForList(
                    "SELECT id FROM queue_items WHERE status = 'pending'"
                            + " AND (available_at IS NULL OR available_at <= ?)"
                            + " ORDER BY updated_at ASC, id ASC LIMIT ?",
                    String.class, timestamp(now()), CLAIM_BATCH_SIZE);
            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            for (String id : candidates) {
                Optional<QueueItem> claimed = updateIf(id, DownloadStatus.PENDING, item -> {
                    item.setStatus(DownloadStatus.DOWNLOADING);
                    item.setAvailableAt(null);
                });
                if (claimed.isPresent()) {
                    return claimed;
                }
            }
            // every candidate went to another worker
        }
    }

    /**
     * Earliest {@code available_at} among pending items that are not claimable yet.
     */
    public Optional<Instant> nextAvailableAt() {
        List<Instant> rows = jdbcTemplate.query(
                "SELECT MIN(available_at) AS next_at FROM queue_items"
                        + " WHERE status = 'pending' AND available_at > ?",
                (rs, rowNum) -> readInstant(rs, "next_at"), timestamp(now()));
        return rows.isEmpty() || rows.get(0) == null ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Return items left in downloading by a previous process to pending.
     *
     * @return number of items reset
     */
    public int resetInterrupted() {
        return resetInterrupted(Collections.emptySet());
    }

    /**
     * @param stillRunning ids a worker of this process is still working on; they are left alone
     */
    public int resetInterrupted(@NonNull Set<String> stillRunning) {
        List<String> ids = jdbcTemplate.queryForList(
                "SELECT id FROM queue_items WHERE status = 'downloading' ORDER BY updated_at ASC, id ASC",
                String.class);
        int reset = 0;
        for (String id : ids) {
            if (stillRunning.contains(id)) {
                continue;
            }
            if (updateIf(id, DownloadStatus.DOWNLOADING, item -> item.setStatus(DownloadStatus.PENDING)).isPresent()) {
                reset++;
            }
        }
        return reset;
    }

    /**
     * Remove completed items that are not partial successes.
     */
    public int clearCompleted() {
        return jdbcTemplate.update(
                "DELETE FROM queue_items WHERE status = 'completed'"
                        + " AND NOT (total_tracks > 0 AND completed_tracks < total_tracks)");
    }

    public int clearAll() {
        return jdbcTemplate.update("DELETE FROM queue_items");
    }

    // ---------------------------------------------------------------- history

    /**
     * Append to the history log. Failures are logged and swallowed so the caller's
     * success path is never aborted by a history write.
     */
    public void addToHistory(@NonNull HistoryRecord record) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO download_history"
                            + " (track_id, title, artist, album, file_path, file_size, quality, downloaded_at)"
                            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    record.getTrackId(),
                    record.getTitle(),
                    record.getArtist(),
                    record.getAlbum(),
                    record.getFilePath(),
                    record.getFileSizeBytes(),
                    record.getQuality() != null ? record.getQuality().name() : null,
                    timestamp(record.getDownloadedAt() != null ? micros(record.getDownloadedAt()) : now()));
        } catch (DataAccessException e) {
            log.warn("Failed to record history for track {}: {}", record.getTrackId(), e.getMessage());
        }
    }

    /**
     * Newest first.
     */
    public List<HistoryRecord> getHistory(int offset, int limit) {
        return jdbcTemplate.query(
                "SELECT id, track_id, title, artist, album, file_path, file_size, quality, downloaded_at"
                        + " FROM download_history ORDER BY downloaded_at DESC, id DESC LIMIT ? OFFSET ?",
                HISTORY_ROW_MAPPER, limit, offset);
    }

    public long countHistory() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM download_history", Long.class);
        return count != null ? count : 0L;
    }

    // ---------------------------------------------------------------- child tracks

    /**
     * Record that a child of a composite item succeeded.
     *
     * @return true if this is the first recorded success for the child
     */
    public boolean recordChildSuccess(@NonNull String parentId, @NonNull ChildTrack child) {
        return recordChildSuccess(parentId, null, child);
    }

    /**
     * Record a child success only while the parent row created at {@code parentCreatedAt} exists.
     *
     * @return true if this is the first recorded success for the child of that row
     */
    public boolean recordChildSuccess(@NonNull String parentId, Instant parentCreatedAt, @NonNull ChildTrack child) {
        ReentrantLock lock = locks.forKey(parentId);
        lock.lock();
        try {
            if (!parentPresent(parentId, parentCreatedAt)) {
                log.debug("Dropping result of child {}: parent {} was replaced", child.getTrackId(), parentId);
                return false;
            }
            Optional<ChildTrack> existing = findChild(parentId, child.getTrackId());
            if (existing.isPresent() && existing.get().getStatus() == DownloadStatus.COMPLETED) {
                return false;
            }
            upsertChild(parentId, child, DownloadStatus.COMPLETED, "");
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record that a child failed for good. A child that already succeeded is left as it is.
     */
    public void recordChildFailure(@NonNull String parentId, @NonNull ChildTrack child) {
        recordChildFailure(parentId, null, child);
    }

    public void recordChildFailure(@NonNull String parentId, Instant parentCreatedAt, @NonNull ChildTrack child) {
        ReentrantLock lock = locks.forKey(parentId);
        lock.lock();
        try {
            if (!parentPresent(parentId, parentCreatedAt)) {
                log.debug("Dropping failure of child {}: parent {} was replaced", child.getTrackId(), parentId);
                return;
            }
            Optional<ChildTrack> existing = findChild(parentId, child.getTrackId());
            if (existing.isPresent() && existing.get().getStatus() == DownloadStatus.COMPLETED) {
                return;
            }
            upsertChild(parentId, child, DownloadStatus.FAILED, truncateError(child.getErrorMessage()));
        } finally {
            lock.unlock();
        }
    }

    public Set<String> getCompletedChildIds(@NonNull String parentId) {
        return new HashSet<>(jdbcTemplate.queryForList(
                "SELECT track_id FROM child_tracks WHERE parent_id = ? AND status = 'completed'",
                String.class, parentId));
    }

    public int countCompletedChildren(@NonNull String parentId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM child_tracks WHERE parent_id = ? AND status = 'completed'",
                Integer.class, parentId);
        return count != null ? count : 0;
    }

    public List<ChildTrack> getChildTracks(@NonNull String parentId) {
        return jdbcTemplate.query(
                "SELECT * FROM child_tracks WHERE parent_id = ? ORDER BY updated_at ASC, track_id ASC",
                CHILD_ROW_MAPPER, parentId);
    }

    public List<ChildTrack> getFailedChildTracks(@NonNull String parentId) {
        return jdbcTemplate.query(
                "SELECT * FROM child_tracks WHERE parent_id = ? AND status = 'failed'"
                        + " ORDER BY updated_at ASC, track_id ASC",
                CHILD_ROW_MAPPER, parentId);
    }

    public int clearFailedChildren(@NonNull String parentId) {
        return jdbcTemplate.update(
                "DELETE FROM child_tracks WHERE parent_id = ? AND status = 'failed'", parentId);
    }

    // ---------------------------------------------------------------- internals

    private boolean write(QueueItem stored, Instant previousUpdatedAt) {
        stored.setUpdatedAt(nextTimestamp(previousUpdatedAt));
        stored.setErrorMessage(truncateError(stored.getErrorMessage() != null ? stored.getErrorMessage() : ""));
        stored.setCompletedAt(micros(stored.getCompletedAt()));
        stored.setAvailableAt(micros(stored.getAvailableAt()));
        if (stored.getQuality() == null) {
            stored.setQuality(AudioQuality.MP3_320);
        }

        int rows = jdbcTemplate.update(UPDATE_ITEM,
                stored.getTitle(),
                stored.getArtist(),
                stored.getAlbum(),
                stored.getStatus().code(),
                stored.getProgress(),
                stored.getDownloadUrl(),
                stored.getOutputPath(),
                stored.getErrorMessage(),
                stored.getRetryCount(),
                stored.getTotalTracks(),
                stored.getCompletedTracks(),
                stored.getQuality().name(),
                timestamp(stored.getUpdatedAt()),
                timestamp(stored.getCompletedAt()),
                timestamp(stored.getAvailableAt()),
                stored.getId());
        return rows > 0;
    }

    private boolean parentPresent(String parentId, Instant createdAt) {
        if (createdAt == null) {
            return true;
        }
        Optional<QueueItem> parent = findById(parentId);
        return parent.isPresent() && sameRow(parent.get(), createdAt);
    }

    private static boolean sameRow(QueueItem current, Instant createdAt) {
        return createdAt == null || micros(createdAt).equals(current.getCreatedAt());
    }

    private Optional<ChildTrack> findChild(String parentId, String trackId) {
        List<ChildTrack> rows = jdbcTemplate.query(
                "SELECT * FROM child_tracks WHERE parent_id = ? AND track_id = ?",
                CHILD_ROW_MAPPER, parentId, trackId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private void upsertChild(String parentId, ChildTrack child, DownloadStatus status, String error) {
        jdbcTemplate.update(
                "MERGE INTO child_tracks"
                        + " (parent_id, track_id, title, artist, status, error_message, attempts, file_path, file_size, updated_at)"
                        + " KEY (parent_id, track_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                parentId,
                child.getTrackId(),
                child.getTitle(),
                child.getArtist(),
                status.code(),
                error,
                child.getAttempts(),
                child.getFilePath(),
                child.getFileSizeBytes(),
                timestamp(now()));
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Now, or one microsecond past {@code previous} if the clock has not moved beyond it.
     */
    Instant nextTimestamp(Instant previous) {
        Instant now = now();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plus(1, ChronoUnit.MICROS);
        }
        return now;
    }

    static String truncateError(String error) {
        if (error == null) {
            return "";
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }

    private static Instant micros(Instant instant) {
        return instant != null ? instant.truncatedTo(ChronoUnit.MICROS) : null;
    }

    private static SqlParameterValue timestamp(Instant instant) {
        return new SqlParameterValue(Types.TIMESTAMP_WITH_TIMEZONE,
                instant != null ? instant.atOffset(ZoneOffset.UTC) : null);
    }

    private static Instant readInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static AudioQuality readQuality(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? AudioQuality.valueOf(value) : null;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
