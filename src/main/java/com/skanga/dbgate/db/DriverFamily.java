package com.skanga.dbgate.db;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Database engines whose JDBC URL can be assembled from {@code Driver}, {@code Server}
 * and {@code Database} attributes. The family is recognised from the driver attribute,
 * which may be an ODBC driver description ({@code PostgreSQL Unicode}) or a JDBC class name.
 */
public enum DriverFamily {
    POSTGRESQL("PostgreSQL", "org.postgresql.Driver", List.of("postgres")),
    MARIADB("MariaDB", "org.mariadb.jdbc.Driver", List.of("mariadb")),
    MYSQL("MySQL", "com.mysql.cj.jdbc.Driver", List.of("mysql")),
    SQLSERVER("SQL Server", "com.microsoft.sqlserver.jdbc.SQLServerDriver",
            List.of("sql server", "sqlserver", "sqlncli", "freetds")),
    ORACLE("Oracle Database", "oracle.jdbc.OracleDriver", List.of("oracle")),
    DB2("IBM DB2", "com.ibm.db2.jcc.DB2Driver", List.of("db2")),
    H2("H2 Database", "org.h2.Driver", List.of("org.h2.")),
    HSQLDB("HSQLDB HyperSQL", "org.hsqldb.jdbc.JDBCDriver", List.of("hsqldb", "hypersql")),
    SQLITE("SQLite", "org.sqlite.JDBC", List.of("sqlite"));

    private final String displayName;
    private final String driverClassName;
    private final List<String> markers;

    DriverFamily(String displayName, String driverClassName, List<String> markers) {
        this.displayName = displayName;
        this.driverClassName = driverClassName;
        this.markers = markers;
    }

    public String displayName() {
        return displayName;
    }

    public String driverClassName() {
        return driverClassName;
    }

    /**
     * Recognises the family from a driver attribute, or returns null.
     */
    public static DriverFamily fromDriverName(String driverName) {
        if (driverName == null) {
            return null;
        }
        String lowerName = driverName.trim().toLowerCase(Locale.ROOT);
        for (DriverFamily driverFamily : values()) {
            if (lowerName.equals(driverFamily.name().toLowerCase(Locale.ROOT))) {
                return driverFamily;
            }
            for (String marker : driverFamily.markers) {
                if (lowerName.contains(marker)) {
                    return driverFamily;
                }
            }
        }
        return null;
    }

    /**
     * Recognises the family from a JDBC URL prefix, or returns null.
     */
    public static DriverFamily fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return null;
        }
        String lowerUrl = jdbcUrl.toLowerCase(Locale.ROOT);
        for (DriverFamily driverFamily : values()) {
            if (lowerUrl.startsWith("jdbc:" + driverFamily.name().toLowerCase(Locale.ROOT) + ":")) {
                return driverFamily;
            }
        }
        return null;
    }

    /**
     * Builds a JDBC URL for this family.
     *
     * @param server host with optional port, may be null for embedded engines
     * @param database database name, or file path for file based engines
     */
    public String buildUrl(String server, String database) {
        switch (this) {
            case POSTGRESQL:
                return "jdbc:postgresql://" + server + "/" + nullToEmpty(database);
            case MARIADB:
                return "jdbc:mariadb://" + server + "/" + nullToEmpty(database);
            case MYSQL:
                return "jdbc:mysql://" + server + "/" + nullToEmpty(database);
            case SQLSERVER:
                // ODBC writes the port as host,port
                String sqlServerUrl = "jdbc:sqlserver://" + server.replace(',', ':');
                return database == null ? sqlServerUrl : sqlServerUrl + ";databaseName=" + database;
            case ORACLE:
                return "jdbc:oracle:thin:@//" + server + "/" + nullToEmpty(database);
            case DB2:
                return "jdbc:db2://" + server + "/" + nullToEmpty(database);
            case H2:
                return server == null ? "jdbc:h2:" + database : "jdbc:h2:tcp://" + server + "/" + database;
            case HSQLDB:
                return server == null ? "jdbc:hsqldb:" + database : "jdbc:hsqldb:hsql://" + server + "/" + database;
            case SQLITE:
                return "jdbc:sqlite:" + database;
            default:
                throw new IllegalStateException("Unhandled driver family: " + this);
        }
    }

    /**
     * Whether the family can work without a server attribute.
     */
    public boolean isEmbeddable() {
        return this == H2 || this == HSQLDB || this == SQLITE;
    }

    /**
     * Properties forcing UTF-8 for character data, for the families that expose such a setting.
     */
    public Map<String, String> unicodeProperties() {
        if (this == MYSQL || this == MARIADB) {
            return Map.of("useUnicode", "true", "characterEncoding", "UTF-8");
        }
        return Map.of();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
