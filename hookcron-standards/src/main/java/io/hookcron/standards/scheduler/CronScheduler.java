package io.hookcron.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;
import io.hookcron.spi.NextFireTime;
import io.hookcron.spi.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CronScheduler
        implements Scheduler
{
    private static final Logger logger = LoggerFactory.getLogger(CronScheduler.class);

    private final CronExpression expression;
    private final ZoneId timeZone;

    CronScheduler(CronExpression expression, ZoneId timeZone)
    {
        this.expression = expression;
        this.timeZone = timeZone;
    }

    @Override
    public ZoneId getTimeZone()
    {
        return timeZone;
    }

    @Override
    public NextFireTime nextFireTime(Instant lastFireTime)
    {
        Optional<Instant> next = expression.next(lastFireTime, timeZone);
        if (!next.isPresent()) {
            logger.debug("Cron expression '{}' has no matching time within {} days after {}",
                    expression, CronExpression.MAX_SEARCH_DAYS, lastFireTime);
            return NextFireTime.terminal();
        }
        return NextFireTime.of(next.get());
    }

    @Override
    public String toString()
    {
        return "CronScheduler{" + expression + ", " + timeZone + "}";
    }
}
