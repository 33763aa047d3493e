package com.github.deemusic.store;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Brings the store schema up to the latest version. Applied versions are recorded in
 * {@code schema_migrations}, so running this against an up-to-date database does nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaMigrator {

    static final List<Migration> MIGRATIONS = List.of(
            new Migration(1, "create_queue_items", List.of(
                    "CREATE TABLE IF NOT EXISTS queue_items ("
                            + " id VARCHAR(128) PRIMARY KEY,"
                            + " type VARCHAR(16) NOT NULL,"
                            + " title VARCHAR(512),"
                            + " artist VARCHAR(512),"
                            + " album VARCHAR(512),"
                            + " status VARCHAR(16) NOT NULL DEFAULT 'pending',"
                            + " progress INT NOT NULL DEFAULT 0,"
                            + " download_url VARCHAR(2048),"
                            + " output_path VARCHAR(2048),"
                            + " error_message VARCHAR(4000) DEFAULT '',"
                            + " retry_count INT NOT NULL DEFAULT 0,"
                            + " total_tracks INT NOT NULL DEFAULT 0,"
                            + " completed_tracks INT NOT NULL DEFAULT 0,"
                            + " created_at TIMESTAMP(6) WITH TIME ZONE NOT NULL,"
                            + " updated_at TIMESTAMP(6) WITH TIME ZONE NOT NULL,"
                            + " completed_at TIMESTAMP(6) WITH TIME ZONE,"
                            + " CONSTRAINT chk_queue_progress CHECK (progress BETWEEN 0 AND 100),"
                            + " CONSTRAINT chk_queue_tracks CHECK (completed_tracks BETWEEN 0 AND total_tracks))")),
            new Migration(2, "create_download_history", List.of(
                    "CREATE TABLE IF NOT EXISTS download_history ("
                            + " id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
                            + " track_id VARCHAR(128) NOT NULL,"
                            + " title VARCHAR(512),"
                            + " artist VARCHAR(512),"
                            + " album VARCHAR(512),"
                            + " file_path VARCHAR(2048),"
                            + " file_size BIGINT NOT NULL DEFAULT 0,"
                            + " quality VARCHAR(16),"
                            + " downloaded_at TIMESTAMP(6) WITH TIME ZONE NOT NULL)",
                    "CREATE INDEX IF NOT EXISTS idx_history_downloaded_at ON download_history(downloaded_at)")),
            new Migration(3, "add_quality_and_backoff", List.of(
                    "ALTER TABLE queue_items ADD COLUMN IF NOT EXISTS quality VARCHAR(16) DEFAULT 'MP3_320'",
                    "ALTER TABLE queue_items ADD COLUMN IF NOT EXISTS available_at TIMESTAMP(6) WITH TIME ZONE")),
            new Migration(4, "create_child_tracks", List.of(
                    "CREATE TABLE IF NOT EXISTS child_tracks ("
                            + " parent_id VARCHAR(128) NOT NULL,"
                            + " track_id VARCHAR(128) NOT NULL,"
                            + " title VARCHAR(512),"
                            + " artist VARCHAR(512),"
                            + " status VARCHAR(16) NOT NULL,"
                            + " error_message VARCHAR(4000) DEFAULT '',"
                            + " attempts INT NOT NULL DEFAULT 0,"
                            + " file_path VARCHAR(2048),"
                            + " file_size BIGINT NOT NULL DEFAULT 0,"
                            + " updated_at TIMESTAMP(6) WITH TIME ZONE NOT NULL,"
                            + " PRIMARY KEY (parent_id, track_id),"
                            + " CONSTRAINT fk_child_parent FOREIGN KEY (parent_id)"
                            + " REFERENCES queue_items(id) ON DELETE CASCADE)")),
            new Migration(5, "add_queue_indexes", List.of(
                    "CREATE INDEX IF NOT EXISTS idx_queue_status ON queue_items(status)",
                    "CREATE INDEX IF NOT EXISTS idx_queue_created_at ON queue_items(created_at, id)",
                    "CREATE INDEX IF NOT EXISTS idx_queue_claim ON queue_items(status, available_at, updated_at)"))
    );

    private static final String CREATE_MIGRATIONS_TABLE =
            "CREATE TABLE IF NOT EXISTS schema_migrations ("
                    + " version INT PRIMARY KEY,"
                    + " name VARCHAR(128) NOT NULL,"
                    + " applied_at TIMESTAMP NOT NULL)";

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void migrate() {
        jdbcTemplate.execute(CREATE_MIGRATIONS_TABLE);

        int current = currentVersion();
        int applied = 0;
        for (Migration migration : MIGRATIONS) {
            if (migration.getVersion() <= current) {
                continue;
            }
            log.info("Applying schema migration {} ({})", migration.getVersion(), migration.getName());
            for (String statement : migration.getStatements()) {
                jdbcTemplate.execute(statement);
            }
            jdbcTemplate.update("INSERT INTO schema_migrations (version, name, applied_at) VALUES (?, ?, ?)",
                    migration.getVersion(), migration.getName(), Timestamp.from(Instant.now()));
            applied++;
        }

        if (applied > 0) {
            log.info("Schema migrated to version {}", latestVersion());
        } else {
            log.debug("Schema already at version {}", current);
        }
    }

    public int currentVersion() {
        Integer version = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(version), 0) FROM schema_migrations", Integer.class);
        return version != null ? version : 0;
    }

    public static int latestVersion() {
        return MIGRATIONS.get(MIGRATIONS.size() - 1).getVersion();
    }

    @Getter
    @RequiredArgsConstructor
    static class Migration {
        private final int version;
        private final String name;
        private final List<String> statements;
    }
}
