package io.hookcron.core.database;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the schedule database. H2 is used without a pool. PostgreSQL goes through HikariCP.
 */
public class DataSourceProvider
        implements Provider<DataSource>, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(DataSourceProvider.class);

    private final DatabaseConfig config;

    private DataSource ds;
    private HikariDataSource pool;
    // keeps an in-memory h2 database alive until close
    private Connection keepAlive;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            String url = DatabaseConfig.buildJdbcUrl(config);
            logger.debug("Using database URL {}", url);
            if (DatabaseConfig.isPostgres(config.getType())) {
                pool = openPool(url);
                ds = pool;
            }
            else {
                ds = openH2(url);
            }
        }
        return ds;
    }

    private JdbcDataSource openH2(String url)
    {
        JdbcDataSource h2 = new JdbcDataSource();
        h2.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");
        try {
            keepAlive = h2.getConnection();
        }
        catch (SQLException ex) {
            throw new DatabaseException("Failed to open database " + url, ex);
        }
        return h2;
    }

    private HikariDataSource openPool(String url)
    {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("hookcron");
        hikari.setJdbcUrl(url);
        hikari.setDriverClassName("org.postgresql.Driver");
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));
        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000L);
        hikari.setIdleTimeout(config.getIdleTimeout() * 1000L);
        hikari.setValidationTimeout(config.getValidationTimeout() * 1000L);
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(config.getMinimumPoolSize());
        // no connectionTestQuery: ThreadLocalTransactionManager.commit needs Connection.isValid
        // to report a connection whose transaction failed
        return new HikariDataSource(hikari);
    }

    @Override
    public synchronized void close()
    {
        if (pool != null) {
            pool.close();
            pool = null;
        }
        if (keepAlive != null) {
            try {
                keepAlive.close();
            }
            catch (SQLException ex) {
                throw new DatabaseException("Failed to close database", ex);
            }
            finally {
                keepAlive = null;
            }
        }
        ds = null;
    }
}
