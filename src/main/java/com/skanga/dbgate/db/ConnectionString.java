package com.skanga.dbgate.db;

import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parsed connection string. Either a JDBC URL, used as is, or an ODBC style
 * {@code KEY=value;KEY={value with ; inside};...} list with case-insensitive keys.
 */
public final class ConnectionString {
    private static final String JDBC_PREFIX = "jdbc:";

    private final String jdbcUrl;
    private final Map<String, String> attributes;

    private ConnectionString(String jdbcUrl, Map<String, String> attributes) {
        this.jdbcUrl = jdbcUrl;
        this.attributes = attributes;
    }

    /**
     * Parses a connection string.
     *
     * @throws SQLException if the string is empty or a braced value is not terminated
     */
    public static ConnectionString parse(String connectionString) throws SQLException {
        if (connectionString == null || connectionString.trim().isEmpty()) {
            throw new SQLException("Connection string cannot be empty");
        }
        String trimmed = connectionString.trim();
        if (trimmed.regionMatches(true, 0, JDBC_PREFIX, 0, JDBC_PREFIX.length())) {
            return new ConnectionString(trimmed, Map.of());
        }
        return new ConnectionString(null, parseAttributes(trimmed));
    }

    private static Map<String, String> parseAttributes(String connectionString) throws SQLException {
        Map<String, String> parsed = new LinkedHashMap<>();
        int position = 0;
        int length = connectionString.length();

        while (position < length) {
            int equalsIndex = connectionString.indexOf('=', position);
            if (equalsIndex < 0) {
                String trailing = connectionString.substring(position).trim();
                if (!trailing.isEmpty() && !trailing.equals(";")) {
                    throw new SQLException("Malformed connection string attribute: " + trailing);
                }
                break;
            }
            String attrKey = connectionString.substring(position, equalsIndex).trim();
            position = equalsIndex + 1;

            String attrValue;
            if (position < length && connectionString.charAt(position) == '{') {
                int closingIndex = connectionString.indexOf('}', position);
                if (closingIndex < 0) {
                    throw new SQLException("Unterminated braced value for attribute: " + attrKey);
                }
                attrValue = connectionString.substring(position + 1, closingIndex);
                position = closingIndex + 1;
                int separatorIndex = connectionString.indexOf(';', position);
                position = separatorIndex < 0 ? length : separatorIndex + 1;
            } else {
                int separatorIndex = connectionString.indexOf(';', position);
                int valueEnd = separatorIndex < 0 ? length : separatorIndex;
                attrValue = connectionString.substring(position, valueEnd).trim();
                position = valueEnd + 1;
            }

            if (!attrKey.isEmpty()) {
                parsed.put(attrKey, attrValue);
            }
        }
        return parsed;
    }

    public boolean isJdbcUrl() {
        return jdbcUrl != null;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    /**
     * Attributes in the order they appeared, with their original key spelling.
     */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Case-insensitive attribute lookup.
     */
    public String get(String attrKey) {
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            if (attribute.getKey().equalsIgnoreCase(attrKey)) {
                return attribute.getValue();
            }
        }
        return null;
    }
}
