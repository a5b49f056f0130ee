package io.hookcron.core.schedule;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigException;
import io.hookcron.spi.Scheduler;
import io.hookcron.spi.SchedulerFactory;

public class SchedulerManager
{
    // recurrence config without a timezone is evaluated in UTC
    public static final ZoneId DEFAULT_TIME_ZONE = ZoneOffset.UTC;

    private final Map<String, SchedulerFactory> types;

    @Inject
    public SchedulerManager(Set<SchedulerFactory> factories)
    {
        ImmutableMap.Builder<String, SchedulerFactory> builder = ImmutableMap.builder();
        for (SchedulerFactory factory : factories) {
            builder.put(factory.getType(), factory);
        }
        this.types = builder.build();
    }

    public Scheduler getScheduler(String pattern, Config recurrenceConfig)
    {
        SchedulerFactory factory = types.get(pattern);
        if (factory == null) {
            throw new ConfigException("Unknown recurrence pattern: " + pattern);
        }
        return factory.newScheduler(recurrenceConfig, DEFAULT_TIME_ZONE);
    }

    public Scheduler getScheduler(Schedule schedule)
    {
        return getScheduler(schedule.getRecurrencePattern(), schedule.getRecurrenceConfig());
    }
}
