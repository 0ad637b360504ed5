package com.skanga.dbgate.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skanga.dbgate.db.DriverQuirk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads the server configuration from an INI file, a JSON file, or the Claude Desktop configuration.
 *
 * <p>Lookup order used by {@link #load(String)}:
 * <ol>
 *   <li>the explicitly given path</li>
 *   <li>the {@code DBGATE_CONFIG} environment variable, then the {@code dbgate.config} system property</li>
 *   <li>the {@code mcpServerEnv.dbgate} section of the Claude Desktop configuration</li>
 *   <li>{@code ./config/config.ini}</li>
 * </ol>
 */
public final class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String CONFIG_ENV_VAR = "DBGATE_CONFIG";
    public static final String CONFIG_SYSTEM_PROPERTY = "dbgate.config";
    public static final String CLAUDE_SECTION = "dbgate";
    static final String SERVER_SECTION = "SERVER";
    static final Path DEFAULT_CONFIG_PATH = Paths.get("config", "config.ini");

    private static final Set<String> PROFILE_KEYS = Set.of(
            "connection_string", "dsn", "username", "password", "driver", "server", "database",
            "readonly", "driver_quirk");

    private ConfigLoader() {
    }

    /**
     * Loads the configuration using the documented lookup order.
     *
     * @param explicitPath path given on the command line, or null
     * @return the validated configuration
     * @throws IOException if no configuration can be found or a file cannot be read
     * @throws IllegalArgumentException if the configuration content is invalid
     */
    public static ServerConfig load(String explicitPath) throws IOException {
        if (explicitPath != null) {
            Path configPath = Paths.get(explicitPath);
            if (!Files.exists(configPath)) {
                throw new IOException(ResourceManager.getErrorMessage("config.file.not.found", explicitPath));
            }
            return loadFile(configPath);
        }

        String envPath = System.getenv(CONFIG_ENV_VAR);
        if (envPath == null) {
            envPath = System.getProperty(CONFIG_SYSTEM_PROPERTY);
        }
        if (envPath != null && Files.exists(Paths.get(envPath))) {
            return loadFile(Paths.get(envPath));
        }

        ServerConfig claudeConfig = loadFromClaudeConfig(claudeDesktopConfigPath());
        if (claudeConfig != null) {
            return claudeConfig;
        }

        if (Files.exists(DEFAULT_CONFIG_PATH)) {
            return loadFromIni(DEFAULT_CONFIG_PATH);
        }

        throw new IOException(ResourceManager.getErrorMessage("config.not.found", CONFIG_ENV_VAR));
    }

    /**
     * Loads a configuration file, choosing the format from its extension ({@code .json} or INI).
     */
    public static ServerConfig loadFile(Path configPath) throws IOException {
        String fileName = configPath.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".json")) {
            return loadFromJson(configPath);
        }
        return loadFromIni(configPath);
    }

    /**
     * Loads an INI configuration. The {@code [SERVER]} section holds the global settings and
     * every other section is a connection profile named after the section.
     */
    public static ServerConfig loadFromIni(Path iniPath) throws IOException {
        IniFile iniFile = IniFile.load(iniPath);

        String defaultConnection = null;
        int maxRows = ServerLimits.DEFAULT_MAX_ROWS;
        int timeout = ServerLimits.DEFAULT_TIMEOUT_SECONDS;

        if (iniFile.hasSection(SERVER_SECTION)) {
            Map<String, String> serverSection = iniFile.section(SERVER_SECTION);
            defaultConnection = serverSection.get("default_connection");
            maxRows = parseInt(serverSection.get("max_rows"), ServerLimits.DEFAULT_MAX_ROWS, "max_rows");
            timeout = parseInt(serverSection.get("timeout"), ServerLimits.DEFAULT_TIMEOUT_SECONDS, "timeout");
        }

        Map<String, ConnectionProfile> connections = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, String>> section : iniFile.sections().entrySet()) {
            if (SERVER_SECTION.equals(section.getKey())) {
                continue;
            }
            connections.put(section.getKey(), profileFromIniSection(section.getKey(), section.getValue()));
        }

        ServerConfig serverConfig = new ServerConfig(connections, defaultConnection, new ServerLimits(maxRows, timeout));
        logger.info("Configuration loaded from {}: {}", iniPath, serverConfig);
        return serverConfig;
    }

    static ConnectionProfile profileFromIniSection(String sectionName, Map<String, String> sectionValues) {
        ConnectionProfile.Builder builder = ConnectionProfile.builder(sectionName)
                .connectionString(sectionValues.get("connection_string"))
                .dsn(sectionValues.get("dsn"))
                .driver(sectionValues.get("driver"))
                .server(sectionValues.get("server"))
                .database(sectionValues.get("database"))
                .username(sectionValues.get("username"))
                .password(sectionValues.get("password"))
                .readonly(parseBoolean(sectionValues.getOrDefault("readonly", "true")))
                .driverQuirk(DriverQuirk.fromConfigValue(sectionValues.get("driver_quirk")));

        // Anything not specifically processed is passed through to the driver
        for (Map.Entry<String, String> entry : sectionValues.entrySet()) {
            if (!PROFILE_KEYS.contains(entry.getKey())) {
                builder.param(entry.getKey(), entry.getValue());
            }
        }
        return builder.build();
    }

    /**
     * Loads a JSON configuration. The file may either be a Claude Desktop configuration
     * (the {@code mcpServerEnv.dbgate} section is used) or that section on its own.
     */
    public static ServerConfig loadFromJson(Path jsonPath) throws IOException {
        JsonNode rootNode = objectMapper.readTree(jsonPath.toFile());
        JsonNode serverNode = rootNode.path("mcpServerEnv").path(CLAUDE_SECTION);
        if (serverNode.isMissingNode()) {
            serverNode = rootNode;
        }
        ServerConfig serverConfig = fromJsonNode(serverNode);
        logger.info("Configuration loaded from {}: {}", jsonPath, serverConfig);
        return serverConfig;
    }

    /**
     * Loads the {@code mcpServerEnv.dbgate} section of a Claude Desktop configuration file.
     *
     * @return the configuration, or null if the file or the section does not exist or cannot be used
     */
    public static ServerConfig loadFromClaudeConfig(Path claudeConfigPath) {
        if (claudeConfigPath == null || !Files.exists(claudeConfigPath)) {
            return null;
        }
        try {
            JsonNode serverNode = objectMapper.readTree(claudeConfigPath.toFile())
                    .path("mcpServerEnv").path(CLAUDE_SECTION);
            if (serverNode.isMissingNode()) {
                return null;
            }
            ServerConfig serverConfig = fromJsonNode(serverNode);
            logger.info("Configuration loaded from Claude Desktop config {}: {}", claudeConfigPath, serverConfig);
            return serverConfig;
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Error loading Claude Desktop config {}: {}", claudeConfigPath, e.getMessage());
            return null;
        }
    }

    static ServerConfig fromJsonNode(JsonNode serverNode) {
        Map<String, ConnectionProfile> connections = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> profileNodes = serverNode.path("connections").fields();
        while (profileNodes.hasNext()) {
            Map.Entry<String, JsonNode> profileEntry = profileNodes.next();
            connections.put(profileEntry.getKey(), profileFromJson(profileEntry.getKey(), profileEntry.getValue()));
        }

        String defaultConnection = textOrNull(serverNode.get("default_connection"));
        ServerLimits limits = new ServerLimits(
                serverNode.path("max_rows").asInt(ServerLimits.DEFAULT_MAX_ROWS),
                serverNode.path("timeout").asInt(ServerLimits.DEFAULT_TIMEOUT_SECONDS));
        return new ServerConfig(connections, defaultConnection, limits);
    }

    private static ConnectionProfile profileFromJson(String profileName, JsonNode profileNode) {
        ConnectionProfile.Builder builder = ConnectionProfile.builder(profileName)
                .connectionString(textOrNull(profileNode.get("connection_string")))
                .dsn(textOrNull(profileNode.get("dsn")))
                .driver(textOrNull(profileNode.get("driver")))
                .server(textOrNull(profileNode.get("server")))
                .database(textOrNull(profileNode.get("database")))
                .username(textOrNull(profileNode.get("username")))
                .password(textOrNull(profileNode.get("password")))
                .readonly(profileNode.path("readonly").asBoolean(true))
                .driverQuirk(DriverQuirk.fromConfigValue(textOrNull(profileNode.get("driver_quirk"))));

        profileNode.path("additional_params").fields()
                .forEachRemaining(param -> builder.param(param.getKey(), param.getValue().asText()));
        return builder.build();
    }

    /**
     * Default location of the Claude Desktop configuration for the current platform.
     */
    static Path claudeDesktopConfigPath() {
        String osName = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (osName.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData == null ? null : Paths.get(appData, "Claude", "claude_desktop_config.json");
        }
        return Paths.get(System.getProperty("user.home"), "Library", "Application Support", "Claude",
                "claude_desktop_config.json");
    }

    static boolean parseBoolean(String value) {
        if (value == null) {
            return false;
        }
        String lowerValue = value.trim().toLowerCase(Locale.ROOT);
        return lowerValue.equals("true") || lowerValue.equals("yes") || lowerValue.equals("1") || lowerValue.equals("on");
    }

    private static int parseInt(String value, int defaultValue, String keyName) {
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.value.not.integer", keyName, value), e);
        }
    }

    private static String textOrNull(JsonNode valueNode) {
        if (valueNode == null || valueNode.isNull() || valueNode.isMissingNode()) {
            return null;
        }
        return valueNode.asText();
    }
}
