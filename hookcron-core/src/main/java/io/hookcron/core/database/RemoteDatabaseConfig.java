package io.hookcron.core.database;

import com.google.common.base.Optional;
import io.hookcron.client.config.Config;
import org.immutables.value.Value;

import java.util.Locale;
import java.util.Properties;

/**
 * Connection settings of a PostgreSQL server.
 */
@Value.Immutable
public interface RemoteDatabaseConfig
{
    String getUser();

    String getPassword();

    String getHost();

    Optional<Integer> getPort();

    String getDatabase();

    int getLoginTimeout();  // seconds

    int getSocketTimeout();  // seconds

    Optional<String> getSslmode();

    static ImmutableRemoteDatabaseConfig.Builder builder()
    {
        return ImmutableRemoteDatabaseConfig.builder();
    }

    static RemoteDatabaseConfig convertFrom(Config config, String keyPrefix)
    {
        return builder()
            .user(config.get(keyPrefix + "user", String.class))
            .password(config.get(keyPrefix + "password", String.class, ""))
            .host(config.get(keyPrefix + "host", String.class))
            .port(config.getOptional(keyPrefix + "port", Integer.class))
            .database(config.get(keyPrefix + "database", String.class))
            .loginTimeout(config.get(keyPrefix + "loginTimeout", int.class, 30))
            .socketTimeout(config.get(keyPrefix + "socketTimeout", int.class, 1800))
            .sslmode(config.getOptional(keyPrefix + "sslmode", String.class))
            .build();
    }

    default String toJdbcUrl()
    {
        String address = getPort().isPresent()
            ? String.format(Locale.ENGLISH, "%s:%d", getHost(), getPort().get())
            : getHost();
        return "jdbc:postgresql://" + address + "/" + getDatabase();
    }

    default Properties toJdbcProperties()
    {
        Properties props = new Properties();
        props.setProperty("user", getUser());
        props.setProperty("password", getPassword());
        props.setProperty("loginTimeout", Integer.toString(getLoginTimeout()));
        props.setProperty("socketTimeout", Integer.toString(getSocketTimeout()));
        props.setProperty("tcpKeepAlive", "true");
        if (getSslmode().isPresent()) {
            props.setProperty("sslmode", getSslmode().get());
        }
        return props;
    }
}
