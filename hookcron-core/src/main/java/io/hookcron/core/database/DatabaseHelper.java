package io.hookcron.core.database;

import org.h2.jdbcx.JdbcDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.h2.H2DatabasePlugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import javax.sql.DataSource;

public class DatabaseHelper
{
    private DatabaseHelper()
    { }

    public static Jdbi createJdbi(DataSource ds)
    {
        Jdbi jdbi = Jdbi.create(ds);
        jdbi.installPlugin(new SqlObjectPlugin());
        if (ds instanceof JdbcDataSource) {
            jdbi.installPlugin(new H2DatabasePlugin());
        }
        else {
            jdbi.installPlugin(new PostgresPlugin());
        }
        return jdbi;
    }

    /**
     * Creates a {@link Jdbi} that also maps schedule rows and binds {@code Config} arguments.
     */
    static Jdbi createJdbi(DataSource ds, ConfigMapper configMapper)
    {
        Jdbi jdbi = createJdbi(ds);
        jdbi.registerRowMapper(new DatabaseScheduleStoreManager.StoredScheduleMapper(configMapper));
        jdbi.registerRowMapper(new DatabaseScheduleStoreManager.StoredScheduleExecutionMapper());
        jdbi.registerArgument(configMapper.getArgumentFactory());
        return jdbi;
    }
}
