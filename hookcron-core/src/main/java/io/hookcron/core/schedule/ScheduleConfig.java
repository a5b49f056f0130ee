package io.hookcron.core.schedule;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigException;
import io.hookcron.spi.DeliverySender;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduleConfig.class)
@JsonDeserialize(as = ImmutableScheduleConfig.class)
public interface ScheduleConfig
{
    boolean getEnabled();

    int getBatchSize();

    // seconds
    int getPollInterval();

    int getMaxConcurrency();

    // seconds
    int getClaimLease();

    // seconds a one-time schedule may lie in the past when it is created
    int getPastGrace();

    int getMaxPerOwner();

    static ImmutableScheduleConfig.Builder defaultBuilder()
    {
        return ImmutableScheduleConfig.builder()
            .enabled(true)
            .batchSize(100)
            .pollInterval(60)
            .maxConcurrency(8)
            .claimLease(300)
            .pastGrace(60)
            .maxPerOwner(100);
    }

    static ScheduleConfig convertFrom(Config config)
    {
        ScheduleConfig defaults = defaultBuilder().build();
        ScheduleConfig scheduleConfig = defaultBuilder()
            .enabled(config.get("schedule.enabled", boolean.class, defaults.getEnabled()))
            .batchSize(positive(config, "schedule.batch_size", defaults.getBatchSize()))
            .pollInterval(positive(config, "schedule.poll_interval", defaults.getPollInterval()))
            .maxConcurrency(positive(config, "schedule.max_concurrency", defaults.getMaxConcurrency()))
            .claimLease(positive(config, "schedule.claim_lease", defaults.getClaimLease()))
            .pastGrace(config.get("schedule.past_grace", int.class, defaults.getPastGrace()))
            .maxPerOwner(positive(config, "schedule.max_per_owner", defaults.getMaxPerOwner()))
            .build();

        // a claim must outlive the delivery it protects
        int deliveryTimeout = config.get("delivery.timeout", int.class, DeliverySender.DEFAULT_TIMEOUT);
        if (scheduleConfig.getClaimLease() <= deliveryTimeout) {
            throw ConfigException.invalidParameter("schedule.claim_lease", String.format(
                        "must be greater than delivery.timeout (%d) but got %d", deliveryTimeout, scheduleConfig.getClaimLease()));
        }
        return scheduleConfig;
    }

    static int positive(Config config, String key, int defaultValue)
    {
        int value = config.get(key, int.class, defaultValue);
        if (value <= 0) {
            throw ConfigException.notPositive(key, value);
        }
        return value;
    }
}
