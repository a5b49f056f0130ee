package io.hookcron.standards.scheduler;

import java.time.DateTimeException;
import java.time.ZoneId;
import com.google.common.base.Optional;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigException;
import io.hookcron.spi.Scheduler;
import io.hookcron.spi.SchedulerFactory;

public class CronSchedulerFactory
        implements SchedulerFactory
{
    public static final String CRON_EXPRESSION_KEY = "cron_expression";
    public static final String TIMEZONE_KEY = "timezone";

    @Override
    public String getType()
    {
        return "cron";
    }

    @Override
    public Scheduler newScheduler(Config config, ZoneId defaultTimeZone)
    {
        CronExpression expression = CronExpression.parse(config.get(CRON_EXPRESSION_KEY, String.class));
        return new CronScheduler(expression, getTimeZone(config, defaultTimeZone));
    }

    static ZoneId getTimeZone(Config config, ZoneId defaultTimeZone)
    {
        Optional<String> name = config.getOptional(TIMEZONE_KEY, String.class);
        if (!name.isPresent() || name.get().trim().isEmpty()) {
            return defaultTimeZone;
        }
        try {
            return ZoneId.of(name.get().trim());
        }
        catch (DateTimeException ex) {
            throw new ConfigException("Unknown time zone '" + name.get() + "'", ex);
        }
    }
}
