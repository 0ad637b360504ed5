package com.skanga.dbgate.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.dbgate.config.ResourceManager;

import java.util.List;

/**
 * Names and input schemas of the tools announced by {@code tools/list}.
 * Descriptions live in {@code tool-descriptions.yaml}.
 */
public final class ToolDefinitions {
    public static final String LIST_CONNECTIONS = "list-connections";
    public static final String LIST_AVAILABLE_DSNS = "list-available-dsns";
    public static final String TEST_CONNECTION = "test-connection";
    public static final String LIST_TABLES = "list-tables";
    public static final String GET_TABLE_SCHEMA = "get-table-schema";
    public static final String EXECUTE_QUERY = "execute-query";

    public static final List<String> TOOL_NAMES = List.of(
            LIST_CONNECTIONS, LIST_AVAILABLE_DSNS, TEST_CONNECTION, LIST_TABLES, GET_TABLE_SCHEMA, EXECUTE_QUERY);

    static final String ARG_CONNECTION_NAME = "connection_name";
    static final String ARG_TABLE_NAME = "table_name";
    static final String ARG_SQL = "sql";
    static final String ARG_MAX_ROWS = "max_rows";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ToolDefinitions() {
    }

    /**
     * Builds the {@code tools} array of a {@code tools/list} response.
     */
    public static ArrayNode listTools() {
        ArrayNode toolsNode = objectMapper.createArrayNode();
        toolsNode.add(tool(LIST_CONNECTIONS, objectSchema()));
        toolsNode.add(tool(LIST_AVAILABLE_DSNS, objectSchema()));
        toolsNode.add(tool(TEST_CONNECTION, withConnectionName(objectSchema())));

        toolsNode.add(tool(LIST_TABLES, withConnectionName(objectSchema())));

        ObjectNode schemaInput = objectSchema();
        stringProperty(schemaInput, ARG_TABLE_NAME);
        withConnectionName(schemaInput);
        schemaInput.putArray("required").add(ARG_TABLE_NAME);
        toolsNode.add(tool(GET_TABLE_SCHEMA, schemaInput));

        ObjectNode queryInput = objectSchema();
        stringProperty(queryInput, ARG_SQL);
        withConnectionName(queryInput);
        ObjectNode maxRowsProperty = ((ObjectNode) queryInput.get("properties")).putObject(ARG_MAX_ROWS);
        maxRowsProperty.put("type", "integer");
        maxRowsProperty.put("minimum", 1);
        maxRowsProperty.put("description", ResourceManager.getToolDescription("param." + ARG_MAX_ROWS));
        queryInput.putArray("required").add(ARG_SQL);
        toolsNode.add(tool(EXECUTE_QUERY, queryInput));

        return toolsNode;
    }

    private static ObjectNode tool(String toolName, ObjectNode inputSchema) {
        ObjectNode toolNode = objectMapper.createObjectNode();
        toolNode.put("name", toolName);
        toolNode.put("description", ResourceManager.getToolDescription(toolName));
        toolNode.set("inputSchema", inputSchema);
        return toolNode;
    }

    private static ObjectNode objectSchema() {
        ObjectNode schemaNode = objectMapper.createObjectNode();
        schemaNode.put("type", "object");
        schemaNode.putObject("properties");
        return schemaNode;
    }

    private static ObjectNode withConnectionName(ObjectNode schemaNode) {
        stringProperty(schemaNode, ARG_CONNECTION_NAME);
        return schemaNode;
    }

    private static void stringProperty(ObjectNode schemaNode, String propertyName) {
        ObjectNode propertyNode = ((ObjectNode) schemaNode.get("properties")).putObject(propertyName);
        propertyNode.put("type", "string");
        propertyNode.put("description", ResourceManager.getToolDescription("param." + propertyName));
    }
}
