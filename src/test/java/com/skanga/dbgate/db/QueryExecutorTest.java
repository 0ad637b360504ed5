package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ConnectionProfile;
import com.skanga.dbgate.config.ServerConfig;
import com.skanga.dbgate.config.ServerLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryExecutorTest {
    @Mock
    private DatabaseDriver databaseDriver;

    @Mock
    private Connection dbConn;

    @Mock
    private Statement statement;

    @Mock
    private ResultSet resultSet;

    @Mock
    private ResultSetMetaData metaData;

    private QueryExecutor queryExecutor;

    @BeforeEach
    void setUp() throws SQLException {
        ConnectionProfile readonlyProfile = ConnectionProfile.builder("reports")
                .connectionString("jdbc:h2:mem:reports").build();
        ConnectionProfile writableProfile = ConnectionProfile.builder("scratch")
                .connectionString("jdbc:h2:mem:scratch").readonly(false).build();
        ConnectionManager connectionManager = new ConnectionManager(
                ServerConfig.of(new ServerLimits(3, 30), "reports", readonlyProfile, writableProfile), databaseDriver);
        queryExecutor = new QueryExecutor(connectionManager);

        lenient().when(databaseDriver.connect(any())).thenReturn(dbConn);
        lenient().when(dbConn.createStatement()).thenReturn(statement);
        lenient().when(statement.getResultSet()).thenReturn(resultSet);
        lenient().when(resultSet.getMetaData()).thenReturn(metaData);
    }

    private void givenRows(String[] columns, Object[]... rows) throws SQLException {
        when(statement.execute(anyString())).thenReturn(true);
        when(metaData.getColumnCount()).thenReturn(columns.length);
        for (int i = 0; i < columns.length; i++) {
            lenient().when(metaData.getColumnLabel(i + 1)).thenReturn(columns[i]);
        }
        if (rows.length == 0) {
            lenient().when(resultSet.next()).thenReturn(false);
        } else {
            Boolean[] remaining = new Boolean[rows.length];
            Arrays.fill(remaining, true);
            remaining[rows.length - 1] = false;
            lenient().when(resultSet.next()).thenReturn(true, remaining);
        }
        for (int col = 0; col < columns.length; col++) {
            Object first = rows.length > 0 ? rows[0][col] : null;
            Object[] rest = new Object[Math.max(0, rows.length - 1)];
            for (int row = 1; row < rows.length; row++) {
                rest[row - 1] = rows[row][col];
            }
            lenient().when(resultSet.getObject(col + 1)).thenReturn(first, rest);
        }
    }

    @Test
    @DisplayName("Should return at most max_rows rows")
    void shouldLimitRows() throws Exception {
        // Given
        givenRows(new String[]{"id", "name"},
                new Object[]{1, "a"}, new Object[]{2, "b"}, new Object[]{3, "c"},
                new Object[]{4, "d"}, new Object[]{5, "e"});

        // When
        QueryResult queryResult = queryExecutor.execute("SELECT id, name FROM users", null, 2);

        // Then
        assertThat(queryResult.columns()).containsExactly("id", "name");
        assertThat(queryResult.rows()).containsExactly(List.of(1, "a"), List.of(2, "b"));
        assertThat(queryResult.rowCount()).isEqualTo(2);
        assertThat(queryResult.rowLimit()).isEqualTo(2);
        assertThat(queryResult.truncated()).isTrue();
        verify(statement).setMaxRows(2);
    }

    @Test
    @DisplayName("Should apply the configured limit when none is given")
    void shouldUseConfiguredLimit() throws Exception {
        givenRows(new String[]{"id"}, new Object[]{1}, new Object[]{2});

        QueryResult queryResult = queryExecutor.execute("SELECT id FROM users", "reports", null);

        assertThat(queryResult.rowLimit()).isEqualTo(3);
        assertThat(queryResult.rowCount()).isEqualTo(2);
        assertThat(queryResult.truncated()).isFalse();
        verify(statement).setMaxRows(3);
    }

    @Test
    @DisplayName("Should keep null values")
    void shouldKeepNullValues() throws Exception {
        givenRows(new String[]{"id", "note"}, new Object[]{1, null});

        QueryResult queryResult = queryExecutor.execute("SELECT id, note FROM notes", null, null);

        assertThat(queryResult.rows()).hasSize(1);
        assertThat(queryResult.rows().get(0)).containsExactly(1, null);
    }

    @Test
    @DisplayName("Should reject a mutating statement on a read-only profile without executing it")
    void shouldRejectWriteOnReadOnlyProfile() throws Exception {
        assertThatThrownBy(() -> queryExecutor.execute("DELETE FROM users", "reports", null))
                .isInstanceOf(WriteNotAllowedException.class)
                .hasMessage("Write operations are not allowed on read-only connection: reports");

        verify(dbConn, never()).createStatement();
        verify(statement, never()).execute(anyString());
    }

    @Test
    @DisplayName("Should run a mutating statement on a writable profile")
    void shouldExecuteWriteOnWritableProfile() throws Exception {
        when(statement.execute("DELETE FROM temp")).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(4);

        QueryResult queryResult = queryExecutor.execute("DELETE FROM temp", "scratch", null);

        assertThat(queryResult.hasNoResultSet()).isTrue();
        assertThat(queryResult.columns()).isEmpty();
        assertThat(queryResult.rows()).isEmpty();
        verify(statement, never()).getResultSet();
    }

    @Test
    @DisplayName("Should render binary values as hex")
    void shouldRenderBinaryAsHex() throws Exception {
        givenRows(new String[]{"payload"}, new Object[]{new byte[]{0x0A, (byte) 0xFF, 0x00}});

        QueryResult queryResult = queryExecutor.execute("SELECT payload FROM blobs", null, null);

        assertThat(queryResult.rows().get(0)).containsExactly("0x0AFF00");
    }

    @Test
    @DisplayName("Should wrap driver errors")
    void shouldWrapDriverErrors() throws Exception {
        when(statement.execute(anyString())).thenThrow(new SQLException("Table \"MISSING\" not found"));

        assertThatThrownBy(() -> queryExecutor.execute("SELECT * FROM missing", null, null))
                .isInstanceOf(ExecutionFailedException.class)
                .hasMessageContaining("reports")
                .hasMessageContaining("MISSING")
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    @DisplayName("Should reject a non positive max_rows")
    void shouldRejectInvalidMaxRows() throws Exception {
        assertThatThrownBy(() -> queryExecutor.execute("SELECT 1", null, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max_rows");

        verify(databaseDriver, never()).connect(any());
    }

    @Test
    @DisplayName("Should report unknown profiles before connecting")
    void shouldRejectUnknownProfile() throws Exception {
        assertThatThrownBy(() -> queryExecutor.execute("SELECT 1", "nope", null))
                .isInstanceOf(UnknownProfileException.class);

        verify(databaseDriver, never()).connect(any());
    }

    @Test
    void testToSerializable() throws SQLException {
        Blob blob = mock(Blob.class);
        when(blob.length()).thenReturn(2L);
        when(blob.getBytes(anyLong(), anyInt())).thenReturn(new byte[]{0x12, 0x34});
        Clob clob = mock(Clob.class);
        when(clob.length()).thenReturn(5L);
        when(clob.getSubString(1L, 5)).thenReturn("hello");

        assertThat(QueryExecutor.toSerializable(blob)).isEqualTo("0x1234");
        assertThat(QueryExecutor.toSerializable(clob)).isEqualTo("hello");
        assertThat(QueryExecutor.toSerializable(42)).isEqualTo(42);
        assertThat(QueryExecutor.toSerializable(null)).isNull();
        assertThat(QueryExecutor.toHex(new byte[0])).isEqualTo("0x");
    }
}
