package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ConnectionProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link DatabaseDriver} backed by {@link DriverManager}.
 *
 * <p>A connection string is resolved to a JDBC URL in this order: a string starting with
 * {@code jdbc:} is used as is; otherwise the {@code URL} attribute, then a {@code DSN}
 * looked up in the {@link DsnRegistry}, then a URL assembled by the {@link DriverFamily}
 * matching the {@code Driver} attribute. {@code UID}/{@code PWD} become the JDBC
 * {@code user}/{@code password} properties and any other attribute is passed to the driver.
 */
public class JdbcDatabaseDriver implements DatabaseDriver {
    private static final Logger logger = LoggerFactory.getLogger(JdbcDatabaseDriver.class);
    private static final Pattern JAVA_CLASS_NAME = Pattern.compile("^[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)+$");
    private static final Set<String> RESOLUTION_KEYS = Set.of(
            "URL", "DSN", "DRIVER", "SERVER", "DATABASE", "UID", "PWD", "USER", "PASSWORD");

    private final DsnRegistry dsnRegistry;

    public JdbcDatabaseDriver(DsnRegistry dsnRegistry) {
        this.dsnRegistry = dsnRegistry;
    }

    @Override
    public Connection connect(ConnectRequest request) throws SQLException {
        ConnectionString connectionString = ConnectionString.parse(request.connectionString());
        Properties connectionProps = new Properties();
        String jdbcUrl = connectionString.isJdbcUrl()
                ? connectionString.jdbcUrl()
                : resolveUrl(connectionString, connectionProps);

        DriverFamily driverFamily = DriverFamily.fromJdbcUrl(jdbcUrl);
        if (driverFamily != null) {
            for (Map.Entry<String, String> unicodeProp : driverFamily.unicodeProperties().entrySet()) {
                if (!jdbcUrl.contains(unicodeProp.getKey()) && !connectionProps.containsKey(unicodeProp.getKey())) {
                    connectionProps.setProperty(unicodeProp.getKey(), unicodeProp.getValue());
                }
            }
        }

        logger.debug("Opening connection for profile '{}' to {}", request.profileName(),
                ConnectionProfile.maskSensitive(jdbcUrl));
        DriverManager.setLoginTimeout(request.timeoutSeconds());
        Connection dbConn = DriverManager.getConnection(jdbcUrl, connectionProps);

        if (request.explicitAutocommit()) {
            try {
                dbConn.setAutoCommit(true);
            } catch (SQLException e) {
                closeAfterFailure(dbConn, e);
                throw e;
            }
        }
        return dbConn;
    }

    /**
     * Resolves the JDBC URL for an attribute style connection string and collects the driver properties.
     */
    String resolveUrl(ConnectionString connectionString, Properties connectionProps) throws SQLException {
        String driverName = connectionString.get("DRIVER");
        String jdbcUrl = connectionString.get("URL");

        if (jdbcUrl == null && connectionString.get("DSN") != null) {
            DataSourceInfo dataSource = lookupDsn(connectionString.get("DSN"));
            jdbcUrl = dataSource.url();
            if (driverName == null) {
                driverName = dataSource.driver();
            }
        }

        if (driverName != null && JAVA_CLASS_NAME.matcher(driverName).matches()) {
            loadDriverClass(driverName);
        }

        if (jdbcUrl == null) {
            jdbcUrl = buildFamilyUrl(driverName, connectionString.get("SERVER"), connectionString.get("DATABASE"));
        }

        String userName = firstNonNull(connectionString.get("UID"), connectionString.get("USER"));
        String password = firstNonNull(connectionString.get("PWD"), connectionString.get("PASSWORD"));
        if (userName != null) {
            connectionProps.setProperty("user", userName);
        }
        if (password != null) {
            connectionProps.setProperty("password", password);
        }
        for (Map.Entry<String, String> attribute : connectionString.attributes().entrySet()) {
            if (!RESOLUTION_KEYS.contains(attribute.getKey().toUpperCase(Locale.ROOT))) {
                connectionProps.setProperty(attribute.getKey(), attribute.getValue());
            }
        }
        return jdbcUrl;
    }

    private DataSourceInfo lookupDsn(String dsnName) throws SQLException {
        Optional<DataSourceInfo> dataSource;
        try {
            dataSource = dsnRegistry.find(dsnName);
        } catch (IOException e) {
            throw new SQLException("Cannot read data source registry " + dsnRegistry.getRegistryPath()
                    + ": " + e.getMessage(), e);
        }
        if (dataSource.isEmpty()) {
            throw new SQLException("Data source name not found: " + dsnName);
        }
        if (dataSource.get().url() == null || dataSource.get().url().isEmpty()) {
            throw new SQLException("Data source '" + dsnName + "' has no url");
        }
        return dataSource.get();
    }

    private static String buildFamilyUrl(String driverName, String server, String database) throws SQLException {
        DriverFamily driverFamily = DriverFamily.fromDriverName(driverName);
        if (driverFamily == null) {
            throw new SQLException("Cannot build a JDBC URL for driver: " + driverName
                    + ". Use a jdbc: URL, a URL attribute or a registered DSN");
        }
        if (server == null && !driverFamily.isEmbeddable()) {
            throw new SQLException("Server is required for driver: " + driverName);
        }
        if (database == null && driverFamily.isEmbeddable() && server == null) {
            throw new SQLException("Database is required for driver: " + driverName);
        }
        return driverFamily.buildUrl(server, database);
    }

    private static void loadDriverClass(String driverClass) throws SQLException {
        try {
            Class.forName(driverClass);
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver class not found on classpath: " + driverClass, e);
        }
    }

    private static void closeAfterFailure(Connection dbConn, SQLException cause) {
        try {
            dbConn.close();
        } catch (SQLException closeException) {
            cause.addSuppressed(closeException);
        }
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    @Override
    public List<DataSourceInfo> listDataSources() throws IOException {
        return dsnRegistry.list();
    }
}
