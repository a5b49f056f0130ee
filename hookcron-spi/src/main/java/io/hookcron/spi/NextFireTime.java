package io.hookcron.spi;

import java.time.Instant;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Result of a recurrence calculation: the next instant a schedule fires at,
 * or terminal if it never fires again.
 */
@Value.Immutable
public interface NextFireTime
{
    Optional<Instant> getTime();

    default boolean isTerminal()
    {
        return !getTime().isPresent();
    }

    static NextFireTime of(Instant time)
    {
        return ImmutableNextFireTime.builder()
            .time(time)
            .build();
    }

    static NextFireTime terminal()
    {
        return ImmutableNextFireTime.builder().build();
    }
}
