package com.skanga.dbgate.db;

import com.skanga.dbgate.config.ConnectionProfile;
import com.skanga.dbgate.config.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes statements on behalf of tool calls, enforcing the per-profile read-only policy
 * and the row limit.
 */
public class QueryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);
    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private final ConnectionManager connectionManager;

    public QueryExecutor(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    /**
     * Executes a statement and returns at most the effective row limit.
     *
     * @param sqlQuery statement to execute
     * @param profileName profile to run against, null for the default
     * @param maxRows row limit for this call, null to use the configured limit
     * @return the columns and rows produced, coerced for serialization
     * @throws WriteNotAllowedException if the profile is read-only and the statement is mutating
     * @throws ExecutionFailedException if the driver fails to run the statement
     * @throws GatewayException for profile resolution and connection failures
     */
    public QueryResult execute(String sqlQuery, String profileName, Integer maxRows) throws GatewayException {
        if (maxRows != null && maxRows <= 0) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("query.max.rows.invalid", maxRows));
        }
        int rowLimit = maxRows != null ? maxRows : connectionManager.getServerConfig().limits().maxRows();

        ConnectionProfile connectionProfile = connectionManager.resolveProfile(profileName);
        LiveConnection liveConnection = connectionManager.acquire(connectionProfile.name());

        if (connectionProfile.readonly() && !SqlClassifier.isReadOnly(sqlQuery)) {
            logger.warn("SECURITY: Rejected write statement on read-only profile '{}': {}",
                    connectionProfile.name(), sqlQuery);
            throw new WriteNotAllowedException(connectionProfile.name());
        }

        logger.warn("SECURITY: Executing SQL on profile '{}' (limit {}): {}", connectionProfile.name(), rowLimit, sqlQuery);
        long startTime = System.currentTimeMillis();

        try (Statement statement = liveConnection.getConnection().createStatement()) {
            statement.setMaxRows(rowLimit);
            boolean isResultSet = statement.execute(sqlQuery);

            List<String> resultColumns = new ArrayList<>();
            List<List<Object>> resultRows = new ArrayList<>();

            if (isResultSet) {
                try (ResultSet resultSet = statement.getResultSet()) {
                    ResultSetMetaData metaData = resultSet.getMetaData();
                    int columnCount = metaData.getColumnCount();
                    for (int i = 1; i <= columnCount; i++) {
                        resultColumns.add(metaData.getColumnLabel(i));
                    }

                    while (resultRows.size() < rowLimit && resultSet.next()) {
                        List<Object> currRow = new ArrayList<>(columnCount);
                        for (int i = 1; i <= columnCount; i++) {
                            currRow.add(toSerializable(resultSet.getObject(i)));
                        }
                        resultRows.add(currRow);
                    }
                }
            } else {
                logger.info("Statement on profile '{}' affected {} row(s)", connectionProfile.name(), statement.getUpdateCount());
            }

            long executionTime = System.currentTimeMillis() - startTime;
            logger.debug("Query returned {} row(s) in {} ms", resultRows.size(), executionTime);
            return new QueryResult(resultColumns, resultRows, resultRows.size(), rowLimit, executionTime);
        } catch (SQLException e) {
            logger.error("Query execution failed on profile '{}': {}", connectionProfile.name(), e.getMessage());
            throw new ExecutionFailedException(connectionProfile.name(), e);
        }
    }

    /**
     * Converts driver values that do not serialize well into text. Binary content is rendered as
     * {@code 0x}-prefixed hex, character LOBs are read fully, everything else is kept as is.
     */
    static Object toSerializable(Object colValue) throws SQLException {
        if (colValue instanceof byte[]) {
            return toHex((byte[]) colValue);
        }
        if (colValue instanceof Blob) {
            Blob blob = (Blob) colValue;
            return toHex(blob.getBytes(1, (int) blob.length()));
        }
        if (colValue instanceof Clob) {
            Clob clob = (Clob) colValue;
            return clob.getSubString(1, (int) clob.length());
        }
        return colValue;
    }

    static String toHex(byte[] bytes) {
        StringBuilder hexBuilder = new StringBuilder(2 + bytes.length * 2).append("0x");
        for (byte currByte : bytes) {
            hexBuilder.append(HEX_DIGITS[(currByte >> 4) & 0x0F]).append(HEX_DIGITS[currByte & 0x0F]);
        }
        return hexBuilder.toString();
    }
}
