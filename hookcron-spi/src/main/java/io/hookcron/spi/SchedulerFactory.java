package io.hookcron.spi;

import java.time.ZoneId;
import io.hookcron.client.config.Config;

public interface SchedulerFactory
{
    /**
     * Recurrence pattern name stored with a schedule, such as {@code once} or {@code cron}.
     */
    String getType();

    /**
     * Builds a scheduler from the recurrence config of a schedule.
     *
     * @throws io.hookcron.client.config.ConfigException if the config is invalid
     */
    Scheduler newScheduler(Config config, ZoneId defaultTimeZone);
}
