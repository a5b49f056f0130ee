package io.hookcron.core.schedule;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduleDefinition.class)
@JsonDeserialize(as = ImmutableScheduleDefinition.class)
public abstract class ScheduleDefinition
        extends Schedule
{
    public static ImmutableScheduleDefinition.Builder builder()
    {
        return ImmutableScheduleDefinition.builder();
    }
}
