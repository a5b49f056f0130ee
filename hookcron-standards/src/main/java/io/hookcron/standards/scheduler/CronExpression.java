package io.hookcron.standards.scheduler;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.TimeZone;
import java.util.regex.Pattern;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import io.hookcron.client.config.ConfigException;
import it.sauronsoftware.cron4j.InvalidPatternException;
import it.sauronsoftware.cron4j.SchedulingPattern;

/**
 * A 5-field cron expression: {@code minute hour day-of-month month day-of-week}.
 *
 * Each field is {@code *}, a comma-separated list of numbers, or a range with an
 * optional step ({@code N-M/S}). Day-of-week is 0-6 with 0 meaning Sunday.
 * When both day-of-month and day-of-week are restricted, a day matches if either matches.
 */
public class CronExpression
{
    // scan limit for expressions such as "0 0 30 2 *" that never match
    static final int MAX_SEARCH_DAYS = 366 * 4;

    private static final Pattern FIELD_PATTERN = Pattern.compile("\\*|\\d+(,\\d+)*|\\d+-\\d+(/\\d+)?");

    private static final Splitter WHITESPACE = Splitter.on(Pattern.compile("\\s+")).omitEmptyStrings();

    private static final Joiner SPACE = Joiner.on(' ');

    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private final String expression;
    // minute and hour are wildcards here. used to skip days without a match.
    private final SchedulingPattern dayPattern;
    private final SchedulingPattern pattern;

    private CronExpression(String expression, List<String> fields)
    {
        this.expression = expression;
        checkField("minute", fields.get(0), 0, 59);
        checkField("hour", fields.get(1), 0, 23);
        checkField("day-of-month", fields.get(2), 1, 31);
        checkField("month", fields.get(3), 1, 12);
        checkField("day-of-week", fields.get(4), 0, 6);

        this.dayPattern = schedulingPattern("*", "*", fields.get(2), fields.get(3), fields.get(4));
        this.pattern = schedulingPattern(fields.get(0), fields.get(1), fields.get(2), fields.get(3), fields.get(4));
    }

    public static CronExpression parse(String expression)
    {
        if (expression == null) {
            throw new ConfigException("Cron expression is required");
        }
        String trimmed = expression.trim();
        List<String> fields = WHITESPACE.splitToList(trimmed);
        if (fields.size() != 5) {
            throw new ConfigException("Invalid cron expression '" + expression + "': expected 5 fields but got " + fields.size());
        }
        return new CronExpression(trimmed, fields);
    }

    public static boolean isValid(String expression)
    {
        try {
            parse(expression);
            return true;
        }
        catch (ConfigException ex) {
            return false;
        }
    }

    // cron4j requires every field to match. Restricting both day fields means either of them.
    private SchedulingPattern schedulingPattern(String minute, String hour, String dayOfMonth, String month, String dayOfWeek)
    {
        String source;
        if (!dayOfMonth.equals("*") && !dayOfWeek.equals("*")) {
            source = SPACE.join(minute, hour, dayOfMonth, month, "*") + "|" + SPACE.join(minute, hour, "*", month, dayOfWeek);
        }
        else {
            source = SPACE.join(minute, hour, dayOfMonth, month, dayOfWeek);
        }
        try {
            return new SchedulingPattern(source);
        }
        catch (InvalidPatternException ex) {
            throw new ConfigException("Invalid cron expression '" + expression + "': " + ex.getMessage(), ex);
        }
    }

    private void checkField(String name, String field, int min, int max)
    {
        if (!FIELD_PATTERN.matcher(field).matches()) {
            throw invalid(name, field, "unsupported syntax");
        }
        if (field.equals("*")) {
            return;
        }

        int dash = field.indexOf('-');
        if (dash >= 0) {
            int slash = field.indexOf('/');
            int from = parseNumber(name, field, field.substring(0, dash), min, max);
            int to = parseNumber(name, field, field.substring(dash + 1, slash >= 0 ? slash : field.length()), min, max);
            if (slash >= 0) {
                parseNumber(name, field, field.substring(slash + 1), 1, max - min + 1);
            }
            if (from > to) {
                throw invalid(name, field, "range start is greater than range end");
            }
            return;
        }

        for (String value : Splitter.on(',').split(field)) {
            parseNumber(name, field, value, min, max);
        }
    }

    private int parseNumber(String name, String field, String value, int min, int max)
    {
        int n;
        try {
            n = Integer.parseInt(value);
        }
        catch (NumberFormatException ex) {
            throw new ConfigException(String.format("Invalid %s field '%s' in cron expression '%s'", name, field, expression), ex);
        }
        if (n < min || n > max) {
            throw invalid(name, field, String.format("%d is out of range %d-%d", n, min, max));
        }
        return n;
    }

    private ConfigException invalid(String name, String field, String reason)
    {
        return new ConfigException(String.format("Invalid %s field '%s' in cron expression '%s': %s",
                    name, field, expression, reason));
    }

    public String getExpression()
    {
        return expression;
    }

    /**
     * Returns the earliest instant strictly after {@code from} that matches this
     * expression in the given time zone, or absent if none exists within the scan limit.
     */
    public Optional<Instant> next(Instant from, ZoneId zone)
    {
        TimeZone timeZone = TimeZone.getTimeZone(zone);
        LocalDate date = from.atZone(zone).toLocalDate();
        LocalDate last = date.plusDays(MAX_SEARCH_DAYS);

        while (!date.isAfter(last)) {
            if (matchesDay(date)) {
                Optional<Instant> found = firstTimeOfDay(date, zone, timeZone, from);
                if (found.isPresent()) {
                    return found;
                }
            }
            date = date.plusDays(1);
        }
        return Optional.absent();
    }

    boolean matchesDay(LocalDate date)
    {
        // the day fields don't depend on the zone once the local date is fixed
        return dayPattern.match(UTC, date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli());
    }

    private Optional<Instant> firstTimeOfDay(LocalDate date, ZoneId zone, TimeZone timeZone, Instant after)
    {
        for (int minuteOfDay = 0; minuteOfDay < 24 * 60; minuteOfDay++) {
            LocalDateTime local = LocalDateTime.of(date, LocalTime.of(minuteOfDay / 60, minuteOfDay % 60));
            if (zone.getRules().getValidOffsets(local).isEmpty()) {
                // wall-clock time skipped by a DST gap
                continue;
            }
            // atZone picks the earlier offset in an overlap
            Instant candidate = local.atZone(zone).toInstant();
            if (candidate.isAfter(after) && pattern.match(timeZone, candidate.toEpochMilli())) {
                return Optional.of(candidate);
            }
        }
        return Optional.absent();
    }

    @Override
    public String toString()
    {
        return expression;
    }
}
