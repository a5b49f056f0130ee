package io.hookcron.client.config;

/**
 * Thrown when a configuration parameter or a schedule request is invalid.
 * Messages are shown to users as they are.
 */
public class ConfigException
        extends RuntimeException
{
    public ConfigException(String message)
    {
        super(message);
    }

    public ConfigException(Throwable cause)
    {
        super(cause);
    }

    public ConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public static ConfigException invalidParameter(String key, String reason)
    {
        return new ConfigException("Parameter '" + key + "' " + reason);
    }

    public static ConfigException notPositive(String key, long value)
    {
        return invalidParameter(key, "must be positive but got " + value);
    }
}
