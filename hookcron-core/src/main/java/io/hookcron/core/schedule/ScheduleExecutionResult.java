package io.hookcron.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Bookkeeping written back after a claimed schedule was attempted.
 * An absent next execution deactivates the schedule.
 */
@Value.Immutable
public interface ScheduleExecutionResult
{
    Instant getOccurrenceAt();

    Instant getExecutedAt();

    ExecutionOutcome getOutcome();

    Optional<Integer> getStatusCode();

    Optional<String> getMessage();

    Optional<Instant> getNextExecutionAt();

    static ImmutableScheduleExecutionResult.Builder builder()
    {
        return ImmutableScheduleExecutionResult.builder();
    }
}
