package com.skanga.dbgate.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlClassifierTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM users",
            "select id from orders where status = 'open'",
            "  WITH recent AS (SELECT * FROM orders) SELECT * FROM recent",
            "SHOW TABLES",
            "DESCRIBE users",
            "EXPLAIN SELECT 1",
            "VALUES (1, 2)",
            "SELECT update_count FROM stats",
            "SELECT * FROM created_items",
            ""
    })
    void testReadOnlyStatements(String sqlQuery) {
        assertTrue(SqlClassifier.isReadOnly(sqlQuery), sqlQuery);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "INSERT INTO users (name) VALUES ('x')",
            "update users set name = 'y'",
            "DELETE FROM users",
            "DROP TABLE users",
            "CREATE TABLE t (id INT)",
            "ALTER TABLE users ADD COLUMN age INT",
            "TRUNCATE TABLE users",
            "GRANT SELECT ON users TO bob",
            "REVOKE SELECT ON users FROM bob",
            "MERGE INTO users USING src ON (1=1) WHEN MATCHED THEN DELETE",
            "EXEC sp_who",
            "EXECUTE sp_who",
            "CALL refresh_stats()",
            "SET search_path TO public",
            "USE warehouse",
            "   \n\tdelete   from users",
            "DROP/* x */TABLE t",
            "INSERT/**/INTO t VALUES (1)",
            "DELETE/**/FROM t",
            "DROP--x\nTABLE t"
    })
    void testMutatingStatements(String sqlQuery) {
        assertFalse(SqlClassifier.isReadOnly(sqlQuery), sqlQuery);
    }

    @Test
    void testCommentsAreIgnored() {
        assertFalse(SqlClassifier.isReadOnly("-- cleanup\nDELETE FROM users"));
        assertFalse(SqlClassifier.isReadOnly("/* multi\nline */ DROP TABLE users"));
        assertTrue(SqlClassifier.isReadOnly("/* DROP TABLE users */ SELECT 1"));
        assertTrue(SqlClassifier.isReadOnly("SELECT 1 -- DELETE FROM users"));
    }

    @Test
    void testOnlyLeadingStatementIsInspected() {
        // Known gap: a batch is classified by its first statement
        assertTrue(SqlClassifier.isReadOnly("SELECT 1; DROP TABLE users"));
        assertFalse(SqlClassifier.isReadOnly("DROP TABLE users; SELECT 1"));
    }

    @Test
    void testNullIsReadOnly() {
        assertTrue(SqlClassifier.isReadOnly(null));
    }

    @Test
    void testCommentSeparatesKeywords() {
        assertEquals("DROP TABLE T", SqlClassifier.normalize("DROP/* x */TABLE t"));
        assertEquals("INSERT INTO T", SqlClassifier.normalize("INSERT--x\nINTO t"));
    }

    @Test
    void testNormalize() {
        assertEquals("SELECT A FROM B", SqlClassifier.normalize("  select\n\ta  /* x */ from b -- trailing"));
    }
}
