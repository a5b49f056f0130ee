package io.hookcron.core.schedule;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.hookcron.client.api.MessageSnapshot;
import org.immutables.value.Value;

/**
 * What a user submits to create or edit a schedule.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableScheduleRequest.class)
@JsonDeserialize(as = ImmutableScheduleRequest.class)
public interface ScheduleRequest
{
    String getName();

    String getTargetUrl();

    MessageSnapshot getPayload();

    Instant getScheduledAt();

    @Value.Default
    default RecurrenceRequest getRecurrence()
    {
        return RecurrenceRequest.once();
    }

    Optional<Integer> getMaxExecutions();

    static ImmutableScheduleRequest.Builder builder()
    {
        return ImmutableScheduleRequest.builder();
    }
}
