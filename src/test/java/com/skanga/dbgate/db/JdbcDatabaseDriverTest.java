package com.skanga.dbgate.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcDatabaseDriverTest {
    @TempDir
    Path tempDir;

    private JdbcDatabaseDriver databaseDriver;

    @BeforeEach
    void setUp() throws IOException {
        Path registryPath = tempDir.resolve("datasources.ini");
        Files.writeString(registryPath, "[sales]\n"
                + "driver = org.h2.Driver\n"
                + "url = jdbc:h2:mem:dsn_sales;DB_CLOSE_DELAY=-1\n"
                + "[broken]\n"
                + "driver = org.h2.Driver\n");
        databaseDriver = new JdbcDatabaseDriver(new DsnRegistry(registryPath));
    }

    @Test
    @DisplayName("Should build a URL from driver, server and database attributes")
    void shouldResolveFamilyUrl() throws SQLException {
        // Given
        Properties connectionProps = new Properties();
        ConnectionString connectionString = ConnectionString.parse(
                "Driver={PostgreSQL Unicode};Server=localhost:5432;Database=wh;UID=reporter;PWD=secret;sslmode=require");

        // When
        String jdbcUrl = databaseDriver.resolveUrl(connectionString, connectionProps);

        // Then
        assertThat(jdbcUrl).isEqualTo("jdbc:postgresql://localhost:5432/wh");
        assertThat(connectionProps)
                .containsEntry("user", "reporter")
                .containsEntry("password", "secret")
                .containsEntry("sslmode", "require")
                .hasSize(3);
    }

    @Test
    @DisplayName("Should use the URL attribute when present")
    void shouldPreferUrlAttribute() throws SQLException {
        Properties connectionProps = new Properties();
        ConnectionString connectionString = ConnectionString.parse(
                "Driver=org.h2.Driver;URL={jdbc:h2:mem:attr;DB_CLOSE_DELAY=-1};User=sa");

        String jdbcUrl = databaseDriver.resolveUrl(connectionString, connectionProps);

        assertThat(jdbcUrl).isEqualTo("jdbc:h2:mem:attr;DB_CLOSE_DELAY=-1");
        assertThat(connectionProps).containsEntry("user", "sa");
    }

    @Test
    @DisplayName("Should resolve a DSN through the registry")
    void shouldResolveDsn() throws SQLException {
        Properties connectionProps = new Properties();

        String jdbcUrl = databaseDriver.resolveUrl(ConnectionString.parse("DSN=SALES;UID=sa"), connectionProps);

        assertThat(jdbcUrl).isEqualTo("jdbc:h2:mem:dsn_sales;DB_CLOSE_DELAY=-1");
        assertThat(connectionProps).containsEntry("user", "sa");
    }

    @Test
    @DisplayName("Should report resolution failures as SQLException")
    void shouldReportResolutionFailures() {
        Properties connectionProps = new Properties();

        assertThatThrownBy(() -> databaseDriver.resolveUrl(ConnectionString.parse("DSN=unknown"), connectionProps))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("Data source name not found: unknown");
        assertThatThrownBy(() -> databaseDriver.resolveUrl(ConnectionString.parse("DSN=broken"), connectionProps))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("has no url");
        assertThatThrownBy(() -> databaseDriver.resolveUrl(ConnectionString.parse("Driver={Access Driver}"), connectionProps))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("Cannot build a JDBC URL");
        assertThatThrownBy(() -> databaseDriver.resolveUrl(ConnectionString.parse("Driver=PostgreSQL;Database=x"), connectionProps))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("Server is required");
        assertThatThrownBy(() -> databaseDriver.resolveUrl(ConnectionString.parse("Driver=H2"), connectionProps))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("Database is required");
        assertThatThrownBy(() -> databaseDriver.resolveUrl(
                ConnectionString.parse("Driver=com.example.MissingDriver;URL=jdbc:missing:x"), connectionProps))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("com.example.MissingDriver");
    }

    @Test
    @DisplayName("Should open a working H2 connection from a DSN")
    void shouldConnectThroughDsn() throws SQLException {
        ConnectRequest connectRequest = new ConnectRequest("sales", "DSN=sales", true, 5);

        try (Connection dbConn = databaseDriver.connect(connectRequest);
             Statement statement = dbConn.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT 1")) {
            assertThat(dbConn.getAutoCommit()).isTrue();
            assertThat(resultSet.next()).isTrue();
            assertThat(resultSet.getInt(1)).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should open a connection from a plain JDBC URL")
    void shouldConnectWithJdbcUrl() throws SQLException {
        ConnectRequest connectRequest = new ConnectRequest("demo", "jdbc:h2:mem:plain_url", false, 5);

        try (Connection dbConn = databaseDriver.connect(connectRequest)) {
            assertThat(dbConn.isValid(1)).isTrue();
        }
    }

    @Test
    @DisplayName("Should list the registered data sources")
    void shouldListDataSources() throws IOException {
        assertThat(databaseDriver.listDataSources())
                .extracting(DataSourceInfo::name)
                .containsExactly("sales", "broken");
    }

    @Test
    @DisplayName("Should mask the password when the request is logged")
    void shouldMaskRequestPassword() {
        ConnectRequest connectRequest = new ConnectRequest("wh", "Driver=PostgreSQL;Server=h;PWD=topsecret", false, 30);

        assertThat(connectRequest.toString()).doesNotContain("topsecret").contains("PWD=***");
    }
}
