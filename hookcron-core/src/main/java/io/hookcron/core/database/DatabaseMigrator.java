package io.hookcron.core.database;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.hookcron.core.database.migrate.Migration;
import io.hookcron.core.database.migrate.MigrationContext;
import io.hookcron.core.database.migrate.Migration_20250301120000_CreateSchedules;
import io.hookcron.core.database.migrate.Migration_20250301120500_CreateScheduleExecutions;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies the schema migrations in version order. Applied versions are recorded in
 * the {@code schema_migrations} table.
 */
public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private static final List<Migration> MIGRATIONS = ImmutableList.sortedCopyOf(
            Comparator.comparing(Migration::getVersion),
            ImmutableList.of(
                new Migration_20250301120000_CreateSchedules(),
                new Migration_20250301120500_CreateScheduleExecutions()));

    private final Jdbi dbi;
    private final MigrationContext context;

    @Inject
    public DatabaseMigrator(DataSource ds, DatabaseConfig config)
    {
        this(DatabaseHelper.createJdbi(ds), config.getType());
    }

    DatabaseMigrator(Jdbi dbi, String databaseType)
    {
        this.dbi = dbi;
        this.context = new MigrationContext(databaseType);
    }

    /**
     * Creates the schema or brings it up to date.
     *
     * @return number of migrations applied by this call
     */
    public int migrate()
    {
        if (!isInitialized()) {
            try (Handle handle = dbi.open()) {
                handle.execute(context.newCreateTableBuilder("schema_migrations")
                        .addString("name", "not null")
                        .addTimestamp("created_at", "not null")
                        .build());
            }
        }

        int applied = 0;
        for (Migration m : getPendingMigrations()) {
            if (apply(m)) {
                applied++;
            }
        }
        if (applied > 0) {
            logger.info("Applied {} database migrations", applied);
        }
        return applied;
    }

    // h2 runs in this process so synchronized is enough there. postgres also takes a table lock.
    private synchronized boolean apply(Migration m)
    {
        return dbi.inTransaction(handle -> {
            if (context.isPostgres()) {
                handle.execute("LOCK TABLE schema_migrations IN EXCLUSIVE MODE");
            }
            if (appliedVersions(handle).contains(m.getVersion())) {
                return false;
            }
            logger.info("Applying database migration: {} {}", m.getVersion(), m.getName());
            m.migrate(handle, context);
            handle.execute("insert into schema_migrations (name, created_at) values (?, now())", m.getVersion());
            return true;
        });
    }

    /**
     * Returns migrations that {@link #migrate()} would apply. All of them if the schema was never created.
     */
    public List<Migration> getPendingMigrations()
    {
        if (!isInitialized()) {
            return MIGRATIONS;
        }
        Set<String> applied;
        try (Handle handle = dbi.open()) {
            applied = appliedVersions(handle);
        }
        return MIGRATIONS.stream()
            .filter(m -> !applied.contains(m.getVersion()))
            .collect(Collectors.toList());
    }

    public boolean isInitialized()
    {
        try (Handle handle = dbi.open()) {
            handle.createQuery("select name from schema_migrations limit 1")
                .mapTo(String.class)
                .list();
            return true;
        }
        catch (RuntimeException ex) {
            logger.trace("schema_migrations table is not readable", ex);
            return false;
        }
    }

    private static Set<String> appliedVersions(Handle handle)
    {
        return new HashSet<>(handle.createQuery("select name from schema_migrations")
                .mapTo(String.class)
                .list());
    }
}
