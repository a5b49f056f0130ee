package io.hookcron.core.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.hookcron.client.config.ConfigException;

import static java.util.Locale.ENGLISH;

/**
 * Recurrence a user picks when creating a schedule. Only {@code once} and {@code cron}
 * are stored; the named ones are rewritten to a cron expression.
 */
public enum RecurrencePattern
{
    ONCE("once"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    CUSTOM("custom"),
    CRON("cron");

    private final String name;

    RecurrencePattern(String name)
    {
        this.name = name;
    }

    @JsonValue
    public String getName()
    {
        return name;
    }

    public boolean isRecurring()
    {
        return this != ONCE;
    }

    @JsonCreator
    public static RecurrencePattern of(String name)
    {
        String normalized = name.trim().toLowerCase(ENGLISH);
        for (RecurrencePattern pattern : values()) {
            if (pattern.name.equals(normalized)) {
                return pattern;
            }
        }
        throw new ConfigException("Unknown recurrence pattern: " + name);
    }

    @Override
    public String toString()
    {
        return name;
    }
}
