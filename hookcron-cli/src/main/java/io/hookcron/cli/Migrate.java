package io.hookcron.cli;

import io.hookcron.client.ObjectMappers;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigFactory;
import io.hookcron.core.database.DataSourceProvider;
import io.hookcron.core.database.DatabaseConfig;
import io.hookcron.core.database.DatabaseMigrator;
import io.hookcron.core.database.migrate.Migration;

import java.util.List;

import static io.hookcron.cli.SystemExitException.systemExit;

public class Migrate
    extends EmbedCommand
{
    private SubCommand subCommand = null;

    @Override
    public void main()
            throws Exception
    {
        checkArgs();
        ConfigFactory cf = new ConfigFactory(ObjectMappers.objectMapper());
        Config config = cf.fromProperties(buildSystemProperties());
        DatabaseConfig dbConfig = DatabaseConfig.convertFrom(config);
        try (DataSourceProvider dsp = new DataSourceProvider(dbConfig)) {
            DatabaseMigrator migrator = new DatabaseMigrator(dsp.get(), dbConfig);
            switch (subCommand) {
            case RUN:
                runMigrate(migrator);
                break;
            case CHECK:
                checkMigrate(migrator);
                break;
            default:
                throw new IllegalStateException("No command");
            }
        }
    }

    // migrate run
    private void runMigrate(DatabaseMigrator migrator)
    {
        int numApplied = migrator.migrate();
        if (numApplied == 0) {
            out.println("No update");
        }
        else {
            out.println("Migrations successfully finished");
        }
    }

    // migrate check
    private void checkMigrate(DatabaseMigrator migrator)
    {
        if (!migrator.isInitialized()) {
            out.println("No table exist");
            return;
        }

        List<Migration> migrations = migrator.getPendingMigrations();
        for (Migration m : migrations) {
            out.println(m.getVersion() + " " + m.getName());
        }
        if (migrations.isEmpty()) {
            out.println("No update");
        }
    }

    private void checkArgs()
        throws SystemExitException
    {
        if (args.size() != 1) {
            throw usage("Invalid parameters");
        }
        switch (args.get(0)) {
        case "run":
            subCommand = SubCommand.RUN;
            break;
        case "check":
            subCommand = SubCommand.CHECK;
            break;
        default:
            throw usage("Invalid command");
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " migrate (run|check) run or check database migration");
        err.println("  Options:");
        showDatabaseOptions();
        return systemExit(error);
    }

    private enum SubCommand
    {
        RUN,
        CHECK,
    }
}
