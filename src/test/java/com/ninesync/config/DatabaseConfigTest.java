package com.ninesync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.File;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DatabaseConfig unit tests
 */
class DatabaseConfigTest {

    @Test
    @DisplayName("File URL resolves to the parent directory, query stripped")
    void testFileUrl() {
        File dir = DatabaseConfig.databaseDirectory("jdbc:sqlite:./data/ninesync.db?journal_mode=WAL");

        assertThat(dir).isEqualTo(new File("./data/ninesync.db").getAbsoluteFile().getParentFile());
    }

    @Test
    @DisplayName("In-memory and non-SQLite URLs have no directory")
    void testNoDirectory() {
        assertThat(DatabaseConfig.databaseDirectory("jdbc:sqlite::memory:")).isNull();
        assertThat(DatabaseConfig.databaseDirectory("jdbc:sqlite:file::memory:?cache=shared")).isNull();
        assertThat(DatabaseConfig.databaseDirectory("jdbc:h2:mem:test")).isNull();
        assertThat(DatabaseConfig.databaseDirectory(null)).isNull();
    }
}
