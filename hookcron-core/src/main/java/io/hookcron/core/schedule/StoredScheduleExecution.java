package io.hookcron.core.schedule;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * One dispatcher attempt of a schedule.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableStoredScheduleExecution.class)
@JsonDeserialize(as = ImmutableStoredScheduleExecution.class)
public interface StoredScheduleExecution
{
    long getId();

    String getScheduleId();

    // next_execution_at that was claimed
    Instant getOccurrenceAt();

    Instant getExecutedAt();

    ExecutionOutcome getOutcome();

    Optional<Integer> getStatusCode();

    Optional<String> getMessage();
}
