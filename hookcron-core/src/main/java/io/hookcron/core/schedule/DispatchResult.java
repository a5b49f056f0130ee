package io.hookcron.core.schedule;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableDispatchResult.class)
@JsonDeserialize(as = ImmutableDispatchResult.class)
public interface DispatchResult
{
    String getScheduleId();

    String getName();

    ExecutionOutcome getOutcome();

    Optional<Integer> getStatusCode();

    // false if the schedule was deactivated by this attempt
    boolean getContinued();

    Optional<Instant> getNextExecutionAt();

    static ImmutableDispatchResult.Builder builder()
    {
        return ImmutableDispatchResult.builder();
    }
}
