package io.hookcron.core.schedule;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableRecurrenceRequest.class)
@JsonDeserialize(as = ImmutableRecurrenceRequest.class)
public interface RecurrenceRequest
{
    RecurrencePattern getPattern();

    // required by custom and cron
    Optional<String> getCronExpression();

    // IANA name. UTC if absent.
    Optional<String> getTimezone();

    static RecurrenceRequest once()
    {
        return ImmutableRecurrenceRequest.builder()
            .pattern(RecurrencePattern.ONCE)
            .build();
    }

    static RecurrenceRequest of(RecurrencePattern pattern, Optional<String> timezone)
    {
        return ImmutableRecurrenceRequest.builder()
            .pattern(pattern)
            .timezone(timezone)
            .build();
    }

    static RecurrenceRequest cron(String cronExpression, Optional<String> timezone)
    {
        return ImmutableRecurrenceRequest.builder()
            .pattern(RecurrencePattern.CRON)
            .cronExpression(cronExpression)
            .timezone(timezone)
            .build();
    }
}
