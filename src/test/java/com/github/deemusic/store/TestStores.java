package com.github.deemusic.store;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;

/**
 * In-memory H2 stores for tests, wired by hand.
 */
public final class TestStores {

    private TestStores() {
    }

    public static EmbeddedDatabase newDatabase() {
        return new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .build();
    }

    public static QueueStore newStore(EmbeddedDatabase database, Clock clock) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(database);
        SchemaMigrator migrator = new SchemaMigrator(jdbcTemplate);
        migrator.migrate();
        return new QueueStore(jdbcTemplate, clock, migrator);
    }
}
