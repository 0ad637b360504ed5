package com.skanga.dbgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skanga.dbgate.db.ColumnDescriptor;
import com.skanga.dbgate.db.ConnectionStatus;
import com.skanga.dbgate.db.DataSourceInfo;
import com.skanga.dbgate.db.QueryResult;
import com.skanga.dbgate.db.TableDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ResultFormatterTest {
    private final ResultFormatter resultFormatter = new ResultFormatter();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should list connections with the default")
    void shouldFormatConnections() throws Exception {
        JsonNode resultNode = objectMapper.readTree(
                resultFormatter.formatConnections(List.of("demo", "warehouse"), "warehouse"));

        assertThat(resultNode.get("connections")).hasSize(2);
        assertThat(resultNode.get("connections").get(0).asText()).isEqualTo("demo");
        assertThat(resultNode.get("default_connection").asText()).isEqualTo("warehouse");
    }

    @Test
    @DisplayName("Should emit a null default connection")
    void shouldFormatMissingDefault() throws Exception {
        JsonNode resultNode = objectMapper.readTree(resultFormatter.formatConnections(List.of(), null));

        assertThat(resultNode.get("connections").isEmpty()).isTrue();
        assertThat(resultNode.get("default_connection").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should list data sources by name and driver")
    void shouldFormatDataSources() throws Exception {
        JsonNode resultNode = objectMapper.readTree(resultFormatter.formatDataSources(
                List.of(new DataSourceInfo("sales", "org.h2.Driver", "jdbc:h2:mem:sales"))));

        assertThat(resultNode.isArray()).isTrue();
        assertThat(resultNode.get(0).get("name").asText()).isEqualTo("sales");
        assertThat(resultNode.get(0).get("driver").asText()).isEqualTo("org.h2.Driver");
        assertThat(resultNode.get(0).has("url")).isFalse();
    }

    @Test
    @DisplayName("Should describe a successful connection test")
    void shouldFormatConnectedStatus() throws Exception {
        ConnectionStatus connectionStatus = ConnectionStatus.connected("demo", Optional.of("16.2"),
                "PostgreSQL JDBC Driver", "42.7.3", "demo", "PostgreSQL", "16.2");

        JsonNode resultNode = objectMapper.readTree(resultFormatter.formatConnectionStatus(connectionStatus));

        assertThat(resultNode.get("status").asText()).isEqualTo("connected");
        assertThat(resultNode.get("connection_name").asText()).isEqualTo("demo");
        assertThat(resultNode.at("/connection_info/driver_name").asText()).isEqualTo("PostgreSQL JDBC Driver");
        assertThat(resultNode.at("/connection_info/dbms_version").asText()).isEqualTo("16.2");
        assertThat(resultNode.at("/database_info/version").asText()).isEqualTo("16.2");
        assertThat(resultNode.has("error")).isFalse();
    }

    @Test
    @DisplayName("Should leave out the server version when it is unknown")
    void shouldOmitMissingServerVersion() throws Exception {
        ConnectionStatus connectionStatus = ConnectionStatus.connected("demo", Optional.empty(),
                "H2 JDBC Driver", "2.2.224", "DEMO", "H2", "2.2.224");

        JsonNode resultNode = objectMapper.readTree(resultFormatter.formatConnectionStatus(connectionStatus));

        assertThat(resultNode.get("database_info").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should describe a failed connection test")
    void shouldFormatFailedStatus() throws Exception {
        JsonNode resultNode = objectMapper.readTree(resultFormatter.formatConnectionStatus(
                ConnectionStatus.failed("demo", "Login failed")));

        assertThat(resultNode.get("status").asText()).isEqualTo("error");
        assertThat(resultNode.get("error").asText()).isEqualTo("Login failed");
        assertThat(resultNode.has("connection_info")).isFalse();
    }

    @Test
    @DisplayName("Should render tables as a markdown list")
    void shouldFormatTables() {
        String resultText = resultFormatter.formatTables(List.of(
                new TableDescriptor("", "dbo", "customers", "TABLE"),
                new TableDescriptor(null, null, "orders", "TABLE")));

        assertThat(resultText).isEqualTo("### Tables:\n\n- dbo.customers\n- orders\n");
    }

    @Test
    @DisplayName("Should render columns as a markdown table")
    void shouldFormatSchema() {
        String resultText = resultFormatter.formatSchema("customers", List.of(
                new ColumnDescriptor("id", "INTEGER", 10, false, 1),
                new ColumnDescriptor("email", "VARCHAR", 255, true, 2)));

        assertThat(resultText).isEqualTo("### Schema for table customers:\n\n"
                + "| Column | Type | Size | Nullable |\n"
                + "| ------ | ---- | ---- | -------- |\n"
                + "| id | INTEGER | 10 | No |\n"
                + "| email | VARCHAR | 255 | Yes |\n");
    }

    @Test
    @DisplayName("Should render rows with NULL markers and the row count")
    void shouldFormatQueryResult() {
        QueryResult queryResult = new QueryResult(List.of("id", "email"),
                List.of(List.of(1, "a@example.com"), Arrays.asList(2, null)), 2, 100, 3);

        String resultText = resultFormatter.formatQueryResult(queryResult);

        assertThat(resultText).isEqualTo("### Query Results:\n\n"
                + "| id | email |\n"
                + "| --- | --- |\n"
                + "| 1 | a@example.com |\n"
                + "| 2 | NULL |\n"
                + "\n\n_Returned 2 rows_");
    }

    @Test
    @DisplayName("Should mention the limit when it was reached")
    void shouldMentionRowLimit() {
        QueryResult queryResult = new QueryResult(List.of("id"), List.of(List.of(1), List.of(2)), 2, 2, 1);

        assertThat(resultFormatter.formatQueryResult(queryResult))
                .endsWith("_Returned 2 rows_ _(limited to 2 rows)_");
    }

    @Test
    @DisplayName("Should render an empty result set as a header only table")
    void shouldFormatEmptyResultSet() {
        QueryResult queryResult = new QueryResult(List.of("id"), List.of(), 0, 10, 1);

        assertThat(resultFormatter.formatQueryResult(queryResult))
                .startsWith("### Query Results:\n\n| id |\n| --- |\n")
                .endsWith("_Returned 0 rows_");
    }

    @Test
    @DisplayName("Should report statements without a result set")
    void shouldFormatNoResultSet() {
        QueryResult queryResult = new QueryResult(List.of(), List.of(), 0, 10, 1);

        assertThat(resultFormatter.formatQueryResult(queryResult)).isEqualTo(ResultFormatter.NO_RESULTS_MESSAGE);
    }
}
