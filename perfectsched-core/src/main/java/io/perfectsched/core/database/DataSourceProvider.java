package io.perfectsched.core.database;

import java.sql.SQLException;
import javax.sql.DataSource;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.perfectsched.commons.ThrowablesUtil;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides the data source of the schedule store. All statements of a backend
 * run on one connection at a time, so the pool holds a single connection.
 */
public class DataSourceProvider
        implements Provider<DataSource>, AutoCloseable
{
    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final DatabaseConfig config;
    private DataSource ds;
    private AutoCloseable closer;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            switch (config.getType()) {
            case "h2":
                // h2 database doesn't need connection pool
                createSimpleDataSource();
                break;
            default:
                createPooledDataSource();
                break;
            }
        }
        return ds;
    }

    private void createSimpleDataSource()
    {
        String url = config.getUrl();

        // An in-memory H2 database is dropped when its last connection is closed.
        // Here holds one Connection until close() so that data survives between sessions.
        JdbcDataSource ds = new JdbcDataSource();
        ds.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");
        if (config.getUser().isPresent()) {
            ds.setUser(config.getUser().get());
        }
        if (config.getPassword().isPresent()) {
            ds.setPassword(config.getPassword().get());
        }

        logger.debug("Using database URL {}", url);

        try {
            this.closer = ds.getConnection();
        }
        catch (SQLException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        this.ds = ds;
    }

    private void createPooledDataSource()
    {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.getUrl());
        hikari.setDriverClassName(DatabaseMigrator.getDriverClassName(config.getType()));
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));

        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000);
        hikari.setValidationTimeout(config.getValidationTimeout() * 1000);
        hikari.setMaximumPoolSize(1);
        hikari.setMinimumIdle(1);

        logger.debug("Using database URL {}", hikari.getJdbcUrl());

        HikariDataSource ds = new HikariDataSource(hikari);
        this.ds = ds;
        this.closer = ds;
    }

    @Override
    public synchronized void close()
    {
        if (ds != null) {
            try {
                closer.close();
            }
            catch (Exception ex) {
                throw ThrowablesUtil.propagate(ex);
            }
            ds = null;
            closer = null;
        }
    }
}
