package com.skanga.dbgate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.dbgate.config.ConfigLoader;
import com.skanga.dbgate.config.ResourceManager;
import com.skanga.dbgate.config.ServerConfig;
import com.skanga.dbgate.db.ConnectionManager;
import com.skanga.dbgate.db.DatabaseDriver;
import com.skanga.dbgate.db.DsnRegistry;
import com.skanga.dbgate.db.JdbcDatabaseDriver;
import com.skanga.dbgate.tools.ToolDefinitions;
import com.skanga.dbgate.tools.ToolDispatcher;
import com.skanga.dbgate.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * MCP server exposing the configured database connections as tools.
 * Speaks newline delimited JSON-RPC 2.0 over stdin and stdout; all logging goes to stderr.
 *
 * <p>The server answers {@code initialize}, {@code ping}, {@code tools/list} and
 * {@code tools/call}. Tool failures are returned as successful responses whose result is
 * flagged with {@code isError}, so a bad query never ends the session.
 */
public class McpServer {
    static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of("2024-11-05", "2025-03-26", "2025-06-18");
    static final String LATEST_PROTOCOL_VERSION = "2025-06-18";

    private static final Logger logger = LoggerFactory.getLogger(McpServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final int PARSE_ERROR = -32700;
    private static final int INVALID_REQUEST = -32600;
    private static final int METHOD_NOT_FOUND = -32601;
    private static final int INVALID_PARAMS = -32602;
    private static final int INTERNAL_ERROR = -32603;

    final ConnectionManager connectionManager;
    private final ToolDispatcher toolDispatcher;

    private enum ServerState {
        UNINITIALIZED,
        INITIALIZING,
        INITIALIZED,
        SHUTDOWN
    }

    private volatile ServerState serverState = ServerState.UNINITIALIZED;

    /**
     * Creates a server for the given configuration, using the driver from {@link #createDatabaseDriver()}.
     */
    public McpServer(ServerConfig serverConfig) {
        this.connectionManager = new ConnectionManager(serverConfig, createDatabaseDriver());
        this.toolDispatcher = new ToolDispatcher(connectionManager);
    }

    /**
     * Creates a server around an existing connection manager.
     */
    public McpServer(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
        this.toolDispatcher = new ToolDispatcher(connectionManager);
    }

    /**
     * Factory for the database driver. Can be overridden in subclasses, typically by tests.
     */
    protected DatabaseDriver createDatabaseDriver() {
        return new JdbcDatabaseDriver(DsnRegistry.fromEnvironment());
    }

    /**
     * Processes one JSON-RPC message.
     *
     * @param requestNode the parsed message
     * @return the response, or null for notifications
     */
    protected JsonNode handleRequest(JsonNode requestNode) {
        String requestMethod = requestNode.path("method").asText();
        JsonNode requestParams = requestNode.path("params");

        boolean isNotification = !requestNode.has("id");
        JsonNode requestId = isNotification ? NullNode.getInstance() : requestNode.get("id");

        logger.debug("Handling request: method={}, id={}, isNotification={}, state={}",
                requestMethod, requestId, isNotification, serverState);

        try {
            if (requestMethod.isEmpty()) {
                throw new InvalidRequestException(ResourceManager.getErrorMessage("protocol.method.missing"));
            }
            enforceLifecycleRules(requestMethod);
            JsonNode resultNode = executeMethod(requestMethod, requestParams);
            return isNotification ? null : createSuccessResponse(resultNode, requestId);
        } catch (Exception e) {
            if (isNotification) {
                logger.warn("Error in notification {}: {}", requestMethod, e.getMessage());
                return null;
            }
            return handleRequestException(e, requestId);
        }
    }

    private void enforceLifecycleRules(String requestMethod) {
        if (serverState == ServerState.SHUTDOWN) {
            throw new InvalidRequestException(ResourceManager.getErrorMessage("lifecycle.shutdown"));
        }
        if (requestMethod.equals("ping")) {
            return;
        }
        if (serverState == ServerState.UNINITIALIZED && !requestMethod.equals("initialize")) {
            throw new InvalidRequestException(ResourceManager.getErrorMessage("lifecycle.not.initialized"));
        }
        if (serverState == ServerState.INITIALIZING && !requestMethod.equals("notifications/initialized")) {
            throw new InvalidRequestException(ResourceManager.getErrorMessage("lifecycle.initializing"));
        }
        if (serverState == ServerState.INITIALIZED && requestMethod.equals("initialize")) {
            throw new InvalidRequestException(ResourceManager.getErrorMessage("lifecycle.already.initialized"));
        }
    }

    private JsonNode executeMethod(String requestMethod, JsonNode requestParams) {
        return switch (requestMethod) {
            case "initialize" -> handleInitialize(requestParams);
            case "notifications/initialized" -> handleNotificationInitialized();
            case "ping" -> objectMapper.createObjectNode();
            case "tools/list" -> handleListTools();
            case "tools/call" -> handleCallTool(requestParams);
            default -> {
                if (requestMethod.startsWith("notifications/")) {
                    logger.debug("Ignoring notification {}", requestMethod);
                    yield null;
                }
                throw new MethodNotFoundException(ResourceManager.getErrorMessage("protocol.method.not.found", requestMethod));
            }
        };
    }

    private JsonNode handleRequestException(Exception theException, JsonNode requestId) {
        if (theException instanceof InvalidRequestException) {
            logger.warn("Lifecycle violation: {}", theException.getMessage());
            return createErrorResponse(INVALID_REQUEST, theException.getMessage(), requestId);
        }
        if (theException instanceof MethodNotFoundException) {
            logger.warn("{}", theException.getMessage());
            return createErrorResponse(METHOD_NOT_FOUND, theException.getMessage(), requestId);
        }
        if (theException instanceof IllegalArgumentException) {
            logger.warn("Invalid request parameters: {}", theException.getMessage());
            return createErrorResponse(INVALID_PARAMS, theException.getMessage(), requestId);
        }
        logger.error("Unexpected error handling request", theException);
        return createErrorResponse(INTERNAL_ERROR,
                ResourceManager.getErrorMessage("protocol.internal.error", theException.getMessage()), requestId);
    }

    private JsonNode handleInitialize(JsonNode requestParams) {
        String clientProtocolVersion = requestParams.path("protocolVersion").asText("");
        String negotiatedVersion = SUPPORTED_PROTOCOL_VERSIONS.contains(clientProtocolVersion)
                ? clientProtocolVersion : LATEST_PROTOCOL_VERSION;
        if (!negotiatedVersion.equals(clientProtocolVersion)) {
            logger.warn("Client requested protocol version '{}', offering {}", clientProtocolVersion, negotiatedVersion);
        }

        JsonNode clientInfo = requestParams.path("clientInfo");
        logger.info("Initializing session for client {} {} (protocol {})",
                clientInfo.path("name").asText("unknown"), clientInfo.path("version").asText(""), negotiatedVersion);
        serverState = ServerState.INITIALIZING;

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.put("protocolVersion", negotiatedVersion);
        ObjectNode capabilitiesNode = resultNode.putObject("capabilities");
        capabilitiesNode.putObject("tools").put("listChanged", false);
        ObjectNode serverInfoNode = resultNode.putObject("serverInfo");
        serverInfoNode.put("name", CliUtils.SERVER_NAME);
        serverInfoNode.put("version", CliUtils.SERVER_VERSION);
        return resultNode;
    }

    private JsonNode handleNotificationInitialized() {
        serverState = ServerState.INITIALIZED;
        logger.info("Server initialized and ready for operation");
        return null;
    }

    private JsonNode handleListTools() {
        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.set("tools", ToolDefinitions.listTools());
        return resultNode;
    }

    JsonNode handleCallTool(JsonNode paramsNode) {
        JsonNode nameNode = paramsNode.path("name");
        if (!nameNode.isTextual() || nameNode.asText().isEmpty()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("protocol.tool.name.missing"));
        }
        String toolName = nameNode.asText();
        ToolResult toolResult = toolDispatcher.dispatch(toolName, paramsNode.path("arguments"));

        ObjectNode resultNode = objectMapper.createObjectNode();
        ArrayNode contentNode = resultNode.putArray("content");
        ObjectNode textContent = contentNode.addObject();
        textContent.put("type", "text");
        textContent.put("text", toolResult.text());
        resultNode.put("isError", toolResult.isError());
        return resultNode;
    }

    private static JsonNode createSuccessResponse(JsonNode resultNode, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        responseNode.set("id", requestId);
        responseNode.set("result", resultNode == null ? objectMapper.createObjectNode() : resultNode);
        return responseNode;
    }

    static JsonNode createErrorResponse(int errorCode, String message, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        responseNode.set("id", requestId == null ? NullNode.getInstance() : requestId);
        ObjectNode errorNode = responseNode.putObject("error");
        errorNode.put("code", errorCode);
        errorNode.put("message", message);
        return responseNode;
    }

    /**
     * Serves requests from stdin until it is closed.
     */
    public void startStdioMode() throws IOException {
        startStdioMode(System.in, System.out);
    }

    /**
     * Serves newline delimited requests from the given stream until it ends, then shuts down.
     */
    void startStdioMode(InputStream inputStream, OutputStream outputStream) throws IOException {
        logger.info("Starting {} in stdio mode...", CliUtils.SERVER_NAME);

        BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        PrintWriter printWriter = new PrintWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), true);
        try {
            String currLine;
            while ((currLine = bufferedReader.readLine()) != null) {
                if (currLine.trim().isEmpty()) {
                    continue;
                }
                JsonNode responseNode = processLine(currLine);
                if (responseNode != null) {
                    printWriter.println(objectMapper.writeValueAsString(responseNode));
                }
            }
        } finally {
            printWriter.flush();
            shutdown();
        }
        logger.info("{} stopped.", CliUtils.SERVER_NAME);
    }

    /**
     * Parses and handles one line of input. Unparseable input yields a parse error with a null id.
     */
    JsonNode processLine(String requestLine) {
        JsonNode requestNode;
        try {
            requestNode = objectMapper.readTree(requestLine);
        } catch (JsonProcessingException e) {
            logger.warn("Unparseable request: {}", e.getOriginalMessage());
            return createErrorResponse(PARSE_ERROR, ResourceManager.getErrorMessage("protocol.parse.error"), null);
        }
        if (requestNode == null || !requestNode.isObject()) {
            return createErrorResponse(INVALID_REQUEST, ResourceManager.getErrorMessage("protocol.invalid.request"), null);
        }
        return handleRequest(requestNode);
    }

    String getServerState() {
        return serverState.toString();
    }

    /**
     * Closes all database connections. Idempotent.
     */
    public void shutdown() {
        if (serverState == ServerState.SHUTDOWN) {
            return;
        }
        logger.info("Shutting down MCP server...");
        serverState = ServerState.SHUTDOWN;
        connectionManager.closeAll();
        logger.info("MCP server shutdown complete");
    }

    /**
     * Entry point. Exit code 2 means the configuration could not be loaded, 3 an unexpected startup error.
     */
    public static void main(String[] args) {
        if (CliUtils.handleHelpAndVersion(args)) {
            System.exit(0);
        }

        ServerConfig serverConfig;
        try {
            serverConfig = ConfigLoader.load(CliUtils.getConfigPath(args));
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Configuration error: {}", e.getMessage());
            logger.error("\n{}", ResourceManager.getErrorMessage("startup.config.error.help"));
            System.exit(2);
            return;
        }

        try {
            McpServer mcpServer = new McpServer(serverConfig);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down {}...", CliUtils.SERVER_NAME);
                mcpServer.shutdown();
            }));
            mcpServer.startStdioMode();
        } catch (Exception e) {
            logger.error("Unexpected error during startup", e);
            logger.error("\n{}", ResourceManager.getErrorMessage("startup.unexpected.error", e.getMessage()));
            System.exit(3);
        }
    }

    /** Request is not valid in the current lifecycle state. */
    static class InvalidRequestException extends RuntimeException {
        InvalidRequestException(String message) {
            super(message);
        }
    }

    static class MethodNotFoundException extends RuntimeException {
        MethodNotFoundException(String message) {
            super(message);
        }
    }
}
