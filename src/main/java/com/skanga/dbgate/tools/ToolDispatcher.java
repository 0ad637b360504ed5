package com.skanga.dbgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.skanga.dbgate.config.ResourceManager;
import com.skanga.dbgate.db.ConnectionManager;
import com.skanga.dbgate.db.MetadataService;
import com.skanga.dbgate.db.QueryExecutor;
import com.skanga.dbgate.db.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes tool calls to the gateway services and renders their results.
 * No failure escapes {@link #dispatch}: every error becomes an error result.
 */
public class ToolDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ConnectionManager connectionManager;
    private final MetadataService metadataService;
    private final QueryExecutor queryExecutor;
    private final ResultFormatter resultFormatter;

    public ToolDispatcher(ConnectionManager connectionManager) {
        this(connectionManager, new MetadataService(connectionManager), new QueryExecutor(connectionManager),
                new ResultFormatter());
    }

    public ToolDispatcher(ConnectionManager connectionManager, MetadataService metadataService,
                          QueryExecutor queryExecutor, ResultFormatter resultFormatter) {
        this.connectionManager = connectionManager;
        this.metadataService = metadataService;
        this.queryExecutor = queryExecutor;
        this.resultFormatter = resultFormatter;
    }

    /**
     * Runs a tool.
     *
     * @param toolName name of the tool
     * @param argsNode tool arguments, may be null or missing
     * @return the rendered result, flagged as an error if the call failed
     */
    public ToolResult dispatch(String toolName, JsonNode argsNode) {
        try {
            return ToolResult.success(execute(toolName, argsNode));
        } catch (Exception | LinkageError e) {
            logger.error("Error executing tool {}: {}", toolName, e.getMessage());
            logger.debug("Tool failure detail", e);
            return ToolResult.error("Error executing " + toolName + ": " + e.getMessage());
        }
    }

    private String execute(String toolName, JsonNode argsNode) throws Exception {
        String connectionName = optionalText(argsNode, ToolDefinitions.ARG_CONNECTION_NAME);
        switch (toolName == null ? "" : toolName) {
            case ToolDefinitions.LIST_CONNECTIONS:
                return resultFormatter.formatConnections(connectionManager.profileNames(),
                        connectionManager.defaultProfileName());
            case ToolDefinitions.LIST_AVAILABLE_DSNS:
                return resultFormatter.formatDataSources(connectionManager.getDatabaseDriver().listDataSources());
            case ToolDefinitions.TEST_CONNECTION:
                return resultFormatter.formatConnectionStatus(metadataService.testConnection(connectionName));
            case ToolDefinitions.LIST_TABLES:
                return resultFormatter.formatTables(metadataService.listTables(connectionName));
            case ToolDefinitions.GET_TABLE_SCHEMA: {
                String tableName = requiredText(argsNode, ToolDefinitions.ARG_TABLE_NAME, "tool.table.name.required");
                return resultFormatter.formatSchema(tableName, metadataService.getTableSchema(tableName, connectionName));
            }
            case ToolDefinitions.EXECUTE_QUERY: {
                String sqlQuery = requiredText(argsNode, ToolDefinitions.ARG_SQL, "tool.sql.required");
                QueryResult queryResult = queryExecutor.execute(sqlQuery, connectionName, optionalMaxRows(argsNode));
                return resultFormatter.formatQueryResult(queryResult);
            }
            default:
                throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.unknown", toolName));
        }
    }

    private static String optionalText(JsonNode argsNode, String argName) {
        if (argsNode == null) {
            return null;
        }
        JsonNode valueNode = argsNode.path(argName);
        if (valueNode.isMissingNode() || valueNode.isNull()) {
            return null;
        }
        String value = valueNode.asText();
        return value.trim().isEmpty() ? null : value;
    }

    private static String requiredText(JsonNode argsNode, String argName, String messageKey) {
        String value = optionalText(argsNode, argName);
        if (value == null) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage(messageKey));
        }
        return value;
    }

    private static Integer optionalMaxRows(JsonNode argsNode) {
        if (argsNode == null) {
            return null;
        }
        JsonNode maxRowsNode = argsNode.path(ToolDefinitions.ARG_MAX_ROWS);
        if (maxRowsNode.isMissingNode() || maxRowsNode.isNull()) {
            return null;
        }
        if (maxRowsNode.canConvertToInt() && maxRowsNode.isIntegralNumber()) {
            return maxRowsNode.intValue();
        }
        if (maxRowsNode.isTextual()) {
            try {
                return Integer.parseInt(maxRowsNode.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        ResourceManager.getErrorMessage("tool.max.rows.not.integer", maxRowsNode.asText()), e);
            }
        }
        throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.max.rows.not.integer", maxRowsNode.toString()));
    }
}
