package com.skanga.dbgate.db;

/**
 * A registered named data source.
 *
 * @param name data source name, referenced with {@code DSN=name}
 * @param driver driver description or JDBC driver class, may be empty
 * @param url JDBC URL the name resolves to
 */
public record DataSourceInfo(String name, String driver, String url) {
}
