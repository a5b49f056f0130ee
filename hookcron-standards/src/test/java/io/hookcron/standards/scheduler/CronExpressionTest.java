package io.hookcron.standards.scheduler;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import com.google.common.base.Optional;
import io.hookcron.client.config.ConfigException;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class CronExpressionTest extends SchedulerTestHelper
{
    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    public void acceptsSupportedSyntax()
    {
        assertThat(CronExpression.isValid("* * * * *"), is(true));
        assertThat(CronExpression.isValid("0 9 * * *"), is(true));
        assertThat(CronExpression.isValid("0,15,30,45 * * * *"), is(true));
        assertThat(CronExpression.isValid("0-30/15 8-17 1-15 1-12 1-5"), is(true));
        assertThat(CronExpression.isValid("  0   9 * *  1  "), is(true));
    }

    @Test
    public void rejectsUnsupportedSyntax()
    {
        assertInvalid("*/5 * * * *", "unsupported syntax");
        assertInvalid("1,2-3 * * * *", "unsupported syntax");
        assertInvalid("a * * * *", "unsupported syntax");
        assertInvalid("* * * *", "expected 5 fields but got 4");
        assertInvalid("* * * * * *", "expected 5 fields but got 6");
        assertInvalid("", "expected 5 fields but got 0");
    }

    @Test
    public void rejectsOutOfRangeValues()
    {
        assertInvalid("60 * * * *", "60 is out of range 0-59");
        assertInvalid("0 24 * * *", "24 is out of range 0-23");
        assertInvalid("0 0 0 * *", "0 is out of range 1-31");
        assertInvalid("0 0 * 13 *", "13 is out of range 1-12");
        assertInvalid("0 0 * * 7", "7 is out of range 0-6");
    }

    @Test
    public void rejectsInvertedRangeAndZeroStep()
    {
        assertInvalid("5-1 * * * *", "range start is greater than range end");
        assertInvalid("0-10/0 * * * *", "0 is out of range");
    }

    @Test
    public void nextIsStrictlyAfter()
    {
        CronExpression cron = CronExpression.parse("0 9 * * *");
        assertThat(cron.next(instant("2024-01-01 10:00:00 +0000"), UTC),
                is(Optional.of(instant("2024-01-02 09:00:00 +0000"))));
        assertThat(cron.next(instant("2024-01-02 09:00:00 +0000"), UTC),
                is(Optional.of(instant("2024-01-03 09:00:00 +0000"))));
        assertThat(cron.next(instant("2024-01-02 08:59:59 +0000"), UTC),
                is(Optional.of(instant("2024-01-02 09:00:00 +0000"))));
    }

    @Test
    public void nextHasZeroSeconds()
    {
        CronExpression cron = CronExpression.parse("* * * * *");
        Instant next = cron.next(Instant.parse("2024-01-01T09:00:30.250Z"), UTC).get();
        assertThat(next, is(Instant.parse("2024-01-01T09:01:00Z")));
    }

    @Test
    public void stepsInsideRange()
    {
        CronExpression cron = CronExpression.parse("0-30/15 10 * * *");
        assertThat(cron.next(instant("2024-01-01 10:00:00 +0000"), UTC),
                is(Optional.of(instant("2024-01-01 10:15:00 +0000"))));
        assertThat(cron.next(instant("2024-01-01 10:15:00 +0000"), UTC),
                is(Optional.of(instant("2024-01-01 10:30:00 +0000"))));
        assertThat(cron.next(instant("2024-01-01 10:30:00 +0000"), UTC),
                is(Optional.of(instant("2024-01-02 10:00:00 +0000"))));
    }

    @Test
    public void dayOfMonthOrDayOfWeekWhenBothRestricted()
    {
        // 13th of the month or Friday
        CronExpression cron = CronExpression.parse("0 0 13 * 5");
        // 2024-01-10 is a Wednesday
        assertThat(cron.next(instant("2024-01-10 00:00:00 +0000"), UTC),
                is(Optional.of(instant("2024-01-12 00:00:00 +0000"))));
        assertThat(cron.next(instant("2024-01-12 00:00:00 +0000"), UTC),
                is(Optional.of(instant("2024-01-13 00:00:00 +0000"))));
        assertThat(cron.next(instant("2024-01-13 00:00:00 +0000"), UTC),
                is(Optional.of(instant("2024-01-19 00:00:00 +0000"))));
    }

    @Test
    public void dayOfWeekOnly()
    {
        // 2024-01-01 is a Monday
        CronExpression cron = CronExpression.parse("0 0 * * 1");
        assertThat(cron.next(instant("2024-01-01 00:00:00 +0000"), UTC),
                is(Optional.of(instant("2024-01-08 00:00:00 +0000"))));

        CronExpression sunday = CronExpression.parse("0 0 * * 0");
        assertThat(sunday.matchesDay(LocalDate.of(2024, 1, 7)), is(true));
        assertThat(sunday.matchesDay(LocalDate.of(2024, 1, 8)), is(false));
    }

    @Test
    public void impossibleDateIsAbsent()
    {
        CronExpression cron = CronExpression.parse("0 0 30 2 *");
        assertThat(cron.next(instant("2024-01-01 00:00:00 +0000"), UTC), is(Optional.absent()));
    }

    @Test
    public void leapDayIsFoundWithinSearchLimit()
    {
        CronExpression cron = CronExpression.parse("0 0 29 2 *");
        assertThat(cron.next(instant("2024-03-01 00:00:00 +0000"), UTC),
                is(Optional.of(instant("2028-02-29 00:00:00 +0000"))));
    }

    @Test
    public void skipsTimeInDstGap()
    {
        // clocks jump from 02:00 to 03:00 on 2024-03-10 in New York
        ZoneId zone = ZoneId.of("America/New_York");
        CronExpression cron = CronExpression.parse("30 2 * * *");
        assertThat(cron.next(instant("2024-03-09 12:00:00 +0000"), zone),
                is(Optional.of(instant("2024-03-11 02:30:00 -0400"))));
    }

    @Test
    public void firesOnceInDstOverlap()
    {
        // clocks go back from 02:00 to 01:00 on 2024-11-03 in New York
        ZoneId zone = ZoneId.of("America/New_York");
        CronExpression cron = CronExpression.parse("30 1 * * *");
        Instant first = cron.next(instant("2024-11-02 12:00:00 +0000"), zone).get();
        assertThat(first, is(instant("2024-11-03 01:30:00 -0400")));
        assertThat(cron.next(first, zone),
                is(Optional.of(instant("2024-11-04 01:30:00 -0500"))));
    }

    private static void assertInvalid(String expression, String message)
    {
        try {
            CronExpression.parse(expression);
            fail("expected ConfigException for '" + expression + "'");
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString(message));
        }
    }
}
