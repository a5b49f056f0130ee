package io.hookcron.core.schedule;

import java.time.Instant;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableStoredSchedule.class)
@JsonDeserialize(as = ImmutableStoredSchedule.class)
public abstract class StoredSchedule
        extends Schedule
{
    public abstract String getId();

    public abstract String getOwnerId();

    public abstract int getExecutionCount();

    public abstract Optional<Instant> getNextExecutionAt();

    public abstract Optional<Instant> getLastExecutedAt();

    public abstract boolean getActive();

    public abstract Optional<String> getClaimId();

    public abstract Optional<Instant> getClaimExpireTime();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();

    @JsonIgnore
    public boolean isExhausted()
    {
        return getMaxExecutions().isPresent() && getExecutionCount() >= getMaxExecutions().get();
    }
}
