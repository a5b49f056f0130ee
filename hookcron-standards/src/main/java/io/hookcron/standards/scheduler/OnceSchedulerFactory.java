package io.hookcron.standards.scheduler;

import java.time.ZoneId;
import io.hookcron.client.config.Config;
import io.hookcron.spi.Scheduler;
import io.hookcron.spi.SchedulerFactory;

public class OnceSchedulerFactory
        implements SchedulerFactory
{
    @Override
    public String getType()
    {
        return "once";
    }

    @Override
    public Scheduler newScheduler(Config config, ZoneId defaultTimeZone)
    {
        return new OnceScheduler(CronSchedulerFactory.getTimeZone(config, defaultTimeZone));
    }
}
