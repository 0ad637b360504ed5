package com.skanga.dbgate.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.dbgate.db.ColumnDescriptor;
import com.skanga.dbgate.db.ConnectionStatus;
import com.skanga.dbgate.db.DataSourceInfo;
import com.skanga.dbgate.db.QueryResult;
import com.skanga.dbgate.db.TableDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders tool results as text: pretty printed JSON for structured answers and markdown
 * for tables, schemas and query results.
 */
public class ResultFormatter {
    static final String NO_RESULTS_MESSAGE = "Query executed successfully, but no results were returned.";

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String formatConnections(List<String> profileNames, String defaultProfile) throws JsonProcessingException {
        ObjectNode resultNode = objectMapper.createObjectNode();
        ArrayNode connectionsNode = resultNode.putArray("connections");
        profileNames.forEach(connectionsNode::add);
        if (defaultProfile == null) {
            resultNode.putNull("default_connection");
        } else {
            resultNode.put("default_connection", defaultProfile);
        }
        return objectMapper.writeValueAsString(resultNode);
    }

    public String formatDataSources(List<DataSourceInfo> dataSources) throws JsonProcessingException {
        ArrayNode resultNode = objectMapper.createArrayNode();
        for (DataSourceInfo dataSource : dataSources) {
            ObjectNode dsnNode = resultNode.addObject();
            dsnNode.put("name", dataSource.name());
            dsnNode.put("driver", dataSource.driver());
        }
        return objectMapper.writeValueAsString(resultNode);
    }

    public String formatConnectionStatus(ConnectionStatus connectionStatus) throws JsonProcessingException {
        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.put("status", connectionStatus.status());
        resultNode.put("connection_name", connectionStatus.connectionName());
        if (!connectionStatus.isConnected()) {
            resultNode.put("error", connectionStatus.error());
            return objectMapper.writeValueAsString(resultNode);
        }

        ObjectNode connectionInfo = resultNode.putObject("connection_info");
        connectionInfo.put("driver_name", connectionStatus.driverName());
        connectionInfo.put("driver_version", connectionStatus.driverVersion());
        connectionInfo.put("database_name", connectionStatus.database());
        connectionInfo.put("dbms_name", connectionStatus.dbmsName());
        connectionInfo.put("dbms_version", connectionStatus.dbmsVersion());

        ObjectNode databaseInfo = resultNode.putObject("database_info");
        connectionStatus.serverVersion().ifPresent(version -> databaseInfo.put("version", version));
        return objectMapper.writeValueAsString(resultNode);
    }

    public String formatTables(List<TableDescriptor> tables) {
        StringBuilder resultText = new StringBuilder("### Tables:\n\n");
        for (TableDescriptor table : tables) {
            resultText.append("- ").append(table.qualifiedName()).append("\n");
        }
        return resultText.toString();
    }

    public String formatSchema(String tableName, List<ColumnDescriptor> columns) {
        StringBuilder resultText = new StringBuilder();
        resultText.append("### Schema for table ").append(tableName).append(":\n\n");
        resultText.append("| Column | Type | Size | Nullable |\n");
        resultText.append("| ------ | ---- | ---- | -------- |\n");
        for (ColumnDescriptor column : columns) {
            resultText.append("| ").append(column.name())
                    .append(" | ").append(column.typeName())
                    .append(" | ").append(column.size())
                    .append(" | ").append(column.nullable() ? "Yes" : "No")
                    .append(" |\n");
        }
        return resultText.toString();
    }

    /**
     * Renders a query result as a markdown table followed by the row count. The row limit is
     * mentioned when it was reached, since further rows may have been discarded.
     */
    public String formatQueryResult(QueryResult queryResult) {
        if (queryResult.hasNoResultSet()) {
            return NO_RESULTS_MESSAGE;
        }

        List<String> columns = queryResult.columns();
        StringBuilder resultText = new StringBuilder("### Query Results:\n\n");
        resultText.append("| ").append(String.join(" | ", columns)).append(" |\n");

        List<String> separators = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            separators.add("---");
        }
        resultText.append("| ").append(String.join(" | ", separators)).append(" |\n");

        for (List<Object> row : queryResult.rows()) {
            List<String> cells = new ArrayList<>(row.size());
            for (Object colValue : row) {
                cells.add(colValue == null ? "NULL" : colValue.toString());
            }
            resultText.append("| ").append(String.join(" | ", cells)).append(" |\n");
        }

        resultText.append("\n\n_Returned ").append(queryResult.rowCount()).append(" rows_");
        if (queryResult.truncated()) {
            resultText.append(" _(limited to ").append(queryResult.rowLimit()).append(" rows)_");
        }
        return resultText.toString();
    }
}
