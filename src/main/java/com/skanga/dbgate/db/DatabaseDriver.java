package com.skanga.dbgate.db;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Turns connection strings into physical connections. The seam between the gateway core
 * and the JDBC layer, replaced by mocks in tests.
 */
public interface DatabaseDriver {
    /**
     * Opens a new physical connection.
     *
     * @throws SQLException if the connection string cannot be resolved or the database refuses the connection
     */
    Connection connect(ConnectRequest request) throws SQLException;

    /**
     * Lists the named data sources known to this driver layer.
     *
     * @throws IOException if the registry exists but cannot be read
     */
    List<DataSourceInfo> listDataSources() throws IOException;
}
