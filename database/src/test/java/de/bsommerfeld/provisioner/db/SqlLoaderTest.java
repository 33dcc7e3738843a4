package de.bsommerfeld.provisioner.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SqlLoader reads from "sql/{name}.sql"; schema.sql sits at the classpath
 * root and is not loaded through it.
 */
class SqlLoaderTest {

    @Test
    void load_shouldReturnUpsertModule() {
        String sql = SqlLoader.load("upsert-module");
        assertFalse(sql.isBlank());
        assertTrue(sql.toLowerCase().contains("on conflict"));
    }

    @Test
    void load_shouldReturnResumableQuery() {
        String sql = SqlLoader.load("select-resumable-installation");
        assertTrue(sql.contains("in_progress"));
        assertTrue(sql.toLowerCase().contains("order by started_at desc"));
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        assertSame(SqlLoader.load("insert-checkpoint"), SqlLoader.load("insert-checkpoint"));
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.load("nonexistent-sql-file"));
    }
}
