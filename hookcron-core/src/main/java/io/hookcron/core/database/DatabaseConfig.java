package io.hookcron.core.database;

import com.google.common.base.Optional;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigException;
import org.immutables.value.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * Settings under {@code database.*}. {@code database.type} is one of
 * {@code memory} (default), {@code h2} or {@code postgresql}.
 */
@Value.Immutable
public interface DatabaseConfig
{
    String PREFIX = "database.";

    // h2 or postgresql. memory is h2 without a path.
    String getType();

    Optional<String> getPath();

    // database.opts.* passed to the JDBC driver
    Map<String, String> getOptions();

    Optional<RemoteDatabaseConfig> getRemoteDatabaseConfig();

    boolean getAutoMigrate();

    int getConnectionTimeout();  // seconds

    int getIdleTimeout();  // seconds

    int getValidationTimeout();  // seconds

    int getMaximumPoolSize();

    int getMinimumPoolSize();

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        ImmutableDatabaseConfig.Builder builder = builder()
            .path(Optional.absent())
            .remoteDatabaseConfig(Optional.absent());

        String type = config.get(PREFIX + "type", String.class, "memory");
        if (type.equals("memory")) {
            builder.type("h2");
        }
        else if (type.equals("h2")) {
            builder.type("h2").path(config.get(PREFIX + "path", String.class));
        }
        else if (isPostgres(type)) {
            builder.type(type).remoteDatabaseConfig(RemoteDatabaseConfig.convertFrom(config, PREFIX));
        }
        else {
            throw new ConfigException("Unknown database.type: " + type);
        }

        // every worker holds a connection while it records a result. +2 for the poller and the API.
        int defaultPoolSize = config.get("schedule.max_concurrency", int.class, 8) + 2;

        return builder
            .options(config.extractPrefixed(PREFIX + "opts.").getAsStringMap())
            .autoMigrate(config.get(PREFIX + "migrate", boolean.class, true))
            .connectionTimeout(config.get(PREFIX + "connectionTimeout", int.class, 30))
            .idleTimeout(config.get(PREFIX + "idleTimeout", int.class, 600))
            .validationTimeout(config.get(PREFIX + "validationTimeout", int.class, 5))
            .maximumPoolSize(config.get(PREFIX + "maximumPoolSize", int.class, defaultPoolSize))
            .minimumPoolSize(config.get(PREFIX + "minimumPoolSize", int.class, 1))
            .build();
    }

    static String buildJdbcUrl(DatabaseConfig config)
    {
        if (isPostgres(config.getType())) {
            if (!config.getRemoteDatabaseConfig().isPresent()) {
                throw new IllegalArgumentException("Database type is postgresql but remoteDatabaseConfig is not set");
            }
            return config.getRemoteDatabaseConfig().get().toJdbcUrl();
        }
        if (!config.getType().equals("h2")) {
            throw new ConfigException("Unsupported database type: " + config.getType());
        }
        if (!config.getPath().isPresent()) {
            return "jdbc:h2:mem:hookcron-" + UUID.randomUUID();
        }
        Path dir = Paths.get(config.getPath().get()).toAbsolutePath();
        try {
            Files.createDirectories(dir);
        }
        catch (IOException ex) {
            throw new ConfigException("Failed to create database directory " + dir, ex);
        }
        // h2 requires an absolute path
        return "jdbc:h2:" + dir.resolve("hookcron");
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();
        if (config.getRemoteDatabaseConfig().isPresent()) {
            props.putAll(config.getRemoteDatabaseConfig().get().toJdbcProperties());
        }
        // database.opts.* overrides the defaults
        props.putAll(config.getOptions());
        return props;
    }

    static boolean isPostgres(String databaseType)
    {
        return databaseType.equals("postgresql");
    }
}
