package com.skanga.dbgate.db;

import com.skanga.dbgate.config.IniFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of named data sources, read from an INI file where each section is a data source:
 * <pre>
 * [warehouse]
 * driver = org.postgresql.Driver
 * url = jdbc:postgresql://db.example.com/warehouse
 * </pre>
 * The file is re-read on every lookup so edits are picked up without a restart.
 * A missing file is an empty registry.
 */
public class DsnRegistry {
    private static final Logger logger = LoggerFactory.getLogger(DsnRegistry.class);

    public static final String DSN_FILE_ENV_VAR = "DBGATE_DSN_FILE";
    public static final String DSN_FILE_SYSTEM_PROPERTY = "dbgate.dsn.file";

    private final Path registryPath;

    public DsnRegistry(Path registryPath) {
        this.registryPath = registryPath;
    }

    /**
     * Creates a registry at the configured location: {@code DBGATE_DSN_FILE}, then the
     * {@code dbgate.dsn.file} system property, then {@code ~/.dbgate/datasources.ini}.
     */
    public static DsnRegistry fromEnvironment() {
        String configuredPath = System.getenv(DSN_FILE_ENV_VAR);
        if (configuredPath == null) {
            configuredPath = System.getProperty(DSN_FILE_SYSTEM_PROPERTY);
        }
        Path registryPath = configuredPath != null
                ? Paths.get(configuredPath)
                : Paths.get(System.getProperty("user.home"), ".dbgate", "datasources.ini");
        logger.debug("Data source registry location: {}", registryPath);
        return new DsnRegistry(registryPath);
    }

    public Path getRegistryPath() {
        return registryPath;
    }

    /**
     * Lists all registered data sources in file order.
     */
    public List<DataSourceInfo> list() throws IOException {
        List<DataSourceInfo> dataSources = new ArrayList<>();
        if (registryPath == null || !Files.exists(registryPath)) {
            return dataSources;
        }
        for (Map.Entry<String, Map<String, String>> section : IniFile.load(registryPath).sections().entrySet()) {
            Map<String, String> dsnValues = section.getValue();
            dataSources.add(new DataSourceInfo(section.getKey(),
                    dsnValues.getOrDefault("driver", ""), dsnValues.get("url")));
        }
        return dataSources;
    }

    /**
     * Finds a data source by name, ignoring case.
     */
    public Optional<DataSourceInfo> find(String dsnName) throws IOException {
        for (DataSourceInfo dataSource : list()) {
            if (dataSource.name().equalsIgnoreCase(dsnName)) {
                return Optional.of(dataSource);
            }
        }
        return Optional.empty();
    }
}
