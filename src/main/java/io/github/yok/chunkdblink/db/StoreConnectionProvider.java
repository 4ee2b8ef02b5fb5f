package io.github.yok.chunkdblink.db;

import io.github.yok.chunkdblink.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.springframework.stereotype.Component;

/**
 * Hands out connections to the relational store.
 *
 * <p>
 * This is the explicit store handle: every load or query acquires its own JDBC connection here and
 * closes it when the operation ends. No connection is kept between operations.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class StoreConnectionProvider {

    private final ConnectionConfig connectionConfig;

    private final DbUnitConfigFactory configFactory;

    @Getter
    private final StoreDialect dialect;

    /**
     * Creates a provider and resolves the store dialect.
     *
     * @param connectionConfig store connection settings
     * @param configFactory DBUnit settings applier
     */
    public StoreConnectionProvider(ConnectionConfig connectionConfig,
            DbUnitConfigFactory configFactory) {
        this.connectionConfig = connectionConfig;
        this.configFactory = configFactory;
        this.dialect =
                StoreDialect.resolve(connectionConfig.getUrl(), connectionConfig.getDriverClass());
        log.info("Store dialect resolved: {} (url={})", dialect, connectionConfig.getUrl());
    }

    /**
     * Opens a new JDBC connection. The caller closes it.
     *
     * <p>
     * When a driver class is configured it is loaded explicitly; otherwise JDBC 4 auto-loading is
     * relied on.
     * </p>
     *
     * @return open connection
     * @throws SQLException if the connection cannot be established or the driver class is missing
     */
    public Connection acquire() throws SQLException {
        String driverClass = connectionConfig.getDriverClass();
        if (StringUtils.isNotBlank(driverClass)) {
            try {
                Class.forName(driverClass);
            } catch (ClassNotFoundException e) {
                throw new SQLException("JDBC driver class not found: " + driverClass, e);
            }
        }
        log.debug("Opening store connection: {}", connectionConfig.getUrl());
        return DriverManager.getConnection(connectionConfig.getUrl(), connectionConfig.getUser(),
                connectionConfig.getPassword());
    }

    /**
     * Wraps an open JDBC connection into a configured DBUnit connection.
     *
     * <p>
     * The DBUnit connection caches the store's table list on first use, so it must be created
     * after the target table exists.
     * </p>
     *
     * @param jdbc open JDBC connection, still owned by the caller
     * @return DBUnit connection bound to the connection's current schema
     * @throws SQLException if the schema cannot be read
     * @throws DatabaseUnitException if DBUnit rejects the connection
     */
    public DatabaseConnection openDbUnitConnection(Connection jdbc)
            throws SQLException, DatabaseUnitException {
        String schema = dialect == StoreDialect.MYSQL ? null : jdbc.getSchema();
        DatabaseConnection dbConn = new DatabaseConnection(jdbc, schema);
        configFactory.configure(dbConn.getConfig(), dialect);
        return dbConn;
    }
}
