package com.skanga.dbgate.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Table and column introspection plus connection testing.
 *
 * <p>Introspection first uses the driver's catalog API ({@link DatabaseMetaData}). Drivers that
 * do not implement it, or report nothing, are handled by a SQL fallback: the standard
 * {@code INFORMATION_SCHEMA.TABLES} view for tables and a zero-row probe query for columns.
 * Only when both paths fail is an error reported.
 */
public class MetadataService {
    private static final Logger logger = LoggerFactory.getLogger(MetadataService.class);

    static final String INFORMATION_SCHEMA_TABLES_SQL =
            "SELECT TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, TABLE_TYPE FROM INFORMATION_SCHEMA.TABLES "
                    + "WHERE TABLE_TYPE = 'BASE TABLE'";
    static final String SERVER_VERSION_SQL = "SELECT @@version";
    private static final Set<String> BASE_TABLE_TYPES = Set.of("TABLE", "BASE TABLE");

    private final ConnectionManager connectionManager;

    public MetadataService(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    /**
     * Lists the base tables visible to the profile's connection.
     *
     * @throws MetadataUnavailableException if neither the catalog API nor the information schema works
     */
    public List<TableDescriptor> listTables(String profileName) throws GatewayException {
        LiveConnection liveConnection = connectionManager.acquire(profileName);
        Connection dbConn = liveConnection.getConnection();

        Attempt<List<TableDescriptor>> nativeTables = attempt(() -> nativeTables(dbConn));
        if (nativeTables.succeeded()) {
            return nativeTables.value();
        }
        logger.info("Catalog table listing failed for profile '{}', using information schema: {}",
                liveConnection.getProfileName(), nativeTables.failure().getMessage());

        Attempt<List<TableDescriptor>> schemaTables = attempt(() -> informationSchemaTables(dbConn));
        if (schemaTables.succeeded()) {
            return schemaTables.value();
        }
        Throwable failure = schemaTables.failure();
        failure.addSuppressed(nativeTables.failure());
        throw new MetadataUnavailableException(liveConnection.getProfileName(), failure);
    }

    private static List<TableDescriptor> nativeTables(Connection dbConn) throws SQLException {
        List<TableDescriptor> tables = new ArrayList<>();
        DatabaseMetaData metaData = dbConn.getMetaData();
        try (ResultSet tableRows = metaData.getTables(null, null, "%", null)) {
            while (tableRows.next()) {
                String tableType = tableRows.getString("TABLE_TYPE");
                if (tableType != null && BASE_TABLE_TYPES.contains(tableType.toUpperCase(Locale.ROOT))) {
                    tables.add(new TableDescriptor(tableRows.getString("TABLE_CAT"), tableRows.getString("TABLE_SCHEM"),
                            tableRows.getString("TABLE_NAME"), tableType));
                }
            }
        }
        return tables;
    }

    private static List<TableDescriptor> informationSchemaTables(Connection dbConn) throws SQLException {
        List<TableDescriptor> tables = new ArrayList<>();
        try (Statement statement = dbConn.createStatement();
             ResultSet tableRows = statement.executeQuery(INFORMATION_SCHEMA_TABLES_SQL)) {
            while (tableRows.next()) {
                tables.add(new TableDescriptor(tableRows.getString(1), tableRows.getString(2),
                        tableRows.getString(3), tableRows.getString(4)));
            }
        }
        return tables;
    }

    /**
     * Describes the columns of a table, ordered by position. A name containing a dot is split
     * into schema and table at the first dot.
     *
     * @throws SchemaUnavailableException if the table cannot be described
     */
    public List<ColumnDescriptor> getTableSchema(String tableName, String profileName) throws GatewayException {
        LiveConnection liveConnection = connectionManager.acquire(profileName);
        Connection dbConn = liveConnection.getConnection();

        String schemaName = null;
        String bareTableName = tableName;
        int dotIndex = tableName.indexOf('.');
        if (dotIndex >= 0) {
            schemaName = tableName.substring(0, dotIndex);
            bareTableName = tableName.substring(dotIndex + 1);
        }

        String finalSchemaName = schemaName;
        String finalTableName = bareTableName;
        Attempt<List<ColumnDescriptor>> nativeColumns = attempt(() -> nativeColumns(dbConn, finalSchemaName, finalTableName));
        if (nativeColumns.succeeded() && !nativeColumns.value().isEmpty()) {
            return sortedByPosition(nativeColumns.value());
        }
        logger.debug("No catalog columns for '{}' on profile '{}', using probe query",
                tableName, liveConnection.getProfileName());

        Attempt<List<ColumnDescriptor>> probedColumns = attempt(() -> probeColumns(dbConn, tableName));
        if (probedColumns.succeeded()) {
            return sortedByPosition(probedColumns.value());
        }
        Throwable failure = probedColumns.failure();
        if (!nativeColumns.succeeded()) {
            failure.addSuppressed(nativeColumns.failure());
        }
        throw new SchemaUnavailableException(tableName, failure);
    }

    private static List<ColumnDescriptor> nativeColumns(Connection dbConn, String schemaName, String tableName)
            throws SQLException {
        DatabaseMetaData metaData = dbConn.getMetaData();
        List<ColumnDescriptor> columns = readCatalogColumns(metaData, schemaName, tableName);
        if (!columns.isEmpty()) {
            return columns;
        }

        // Unquoted identifiers are stored folded, retry with the stored case
        if (metaData.storesUpperCaseIdentifiers()) {
            return readCatalogColumns(metaData, upper(schemaName), upper(tableName));
        }
        if (metaData.storesLowerCaseIdentifiers()) {
            return readCatalogColumns(metaData, lower(schemaName), lower(tableName));
        }
        return columns;
    }

    private static List<ColumnDescriptor> readCatalogColumns(DatabaseMetaData metaData, String schemaName, String tableName)
            throws SQLException {
        List<ColumnDescriptor> columns = new ArrayList<>();
        try (ResultSet columnRows = metaData.getColumns(null, schemaName, tableName, "%")) {
            while (columnRows.next()) {
                columns.add(new ColumnDescriptor(
                        columnRows.getString("COLUMN_NAME"),
                        columnRows.getString("TYPE_NAME"),
                        columnRows.getInt("COLUMN_SIZE"),
                        columnRows.getInt("NULLABLE") == DatabaseMetaData.columnNullable,
                        columnRows.getInt("ORDINAL_POSITION")));
            }
        }
        return columns;
    }

    private static List<ColumnDescriptor> probeColumns(Connection dbConn, String tableName) throws SQLException {
        List<ColumnDescriptor> columns = new ArrayList<>();
        try (Statement statement = dbConn.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT * FROM " + tableName + " WHERE 1=0")) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                columns.add(new ColumnDescriptor(
                        metaData.getColumnLabel(i),
                        JdbcTypeNames.nameOf(metaData.getColumnType(i)),
                        metaData.getPrecision(i),
                        metaData.isNullable(i) == ResultSetMetaData.columnNullable,
                        i));
            }
        }
        return columns;
    }

    private static List<ColumnDescriptor> sortedByPosition(List<ColumnDescriptor> columns) {
        List<ColumnDescriptor> sorted = new ArrayList<>(columns);
        sorted.sort(Comparator.comparingInt(ColumnDescriptor::position));
        return sorted;
    }

    /**
     * Tests the profile's connection and collects server details. Never throws: a failure is
     * reported as an error status.
     */
    public ConnectionStatus testConnection(String profileName) {
        String connectionName = profileName;
        try {
            connectionName = connectionManager.resolveProfile(profileName).name();
            LiveConnection liveConnection = connectionManager.acquire(connectionName);
            Connection dbConn = liveConnection.getConnection();

            Attempt<String> serverVersion = attempt(() -> serverVersion(dbConn));
            if (!serverVersion.succeeded()) {
                logger.debug("Server version query not supported on profile '{}': {}",
                        connectionName, serverVersion.failure().getMessage());
            }

            DatabaseMetaData metaData = dbConn.getMetaData();
            return ConnectionStatus.connected(connectionName,
                    serverVersion.succeeded() ? Optional.ofNullable(serverVersion.value()) : Optional.empty(),
                    describe(metaData::getDriverName),
                    describe(metaData::getDriverVersion),
                    describe(dbConn::getCatalog),
                    describe(metaData::getDatabaseProductName),
                    describe(metaData::getDatabaseProductVersion));
        } catch (GatewayException | SQLException | RuntimeException | LinkageError e) {
            logger.warn("Connection test failed for profile '{}': {}", connectionName, e.getMessage());
            return ConnectionStatus.failed(connectionName, e.getMessage());
        }
    }

    private static String serverVersion(Connection dbConn) throws SQLException {
        try (Statement statement = dbConn.createStatement();
             ResultSet resultSet = statement.executeQuery(SERVER_VERSION_SQL)) {
            return resultSet.next() ? resultSet.getString(1) : null;
        }
    }

    private static String describe(JdbcCall<String> detailCall) {
        Attempt<String> detail = attempt(detailCall);
        if (!detail.succeeded() || detail.value() == null) {
            return ConnectionStatus.UNKNOWN;
        }
        return detail.value();
    }

    private static String upper(String identifier) {
        return identifier == null ? null : identifier.toUpperCase(Locale.ROOT);
    }

    private static String lower(String identifier) {
        return identifier == null ? null : identifier.toLowerCase(Locale.ROOT);
    }

    private static <T> Attempt<T> attempt(JdbcCall<T> jdbcCall) {
        try {
            return Attempt.success(jdbcCall.call());
        } catch (SQLException | RuntimeException | LinkageError e) {
            // Catalog APIs missing from older drivers surface as unchecked errors
            return Attempt.failure(e);
        }
    }

    @FunctionalInterface
    interface JdbcCall<T> {
        T call() throws SQLException;
    }

    /**
     * Outcome of one introspection path: either a value or the driver failure that prevented it.
     */
    static final class Attempt<T> {
        private final T value;
        private final Throwable failure;

        private Attempt(T value, Throwable failure) {
            this.value = value;
            this.failure = failure;
        }

        static <T> Attempt<T> success(T value) {
            return new Attempt<>(value, null);
        }

        static <T> Attempt<T> failure(Throwable failure) {
            return new Attempt<>(null, failure);
        }

        boolean succeeded() {
            return failure == null;
        }

        T value() {
            return value;
        }

        Throwable failure() {
            return failure;
        }
    }
}
