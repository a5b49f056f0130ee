package io.hookcron.cli;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

import static io.hookcron.cli.SystemExitException.systemExit;
import static java.util.Locale.ENGLISH;

public class TimeUtil
{
    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z", ENGLISH);

    private static final DateTimeFormatter INSTANT_PARSER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z", ENGLISH);

    private TimeUtil()
    { }

    public static String formatTime(Instant instant)
    {
        return FORMATTER.withZone(ZoneId.systemDefault()).format(instant);
    }

    /**
     * Parses unix seconds, ISO-8601 ({@code 2024-01-01T09:00:00Z}) or
     * {@code yyyy-MM-dd HH:mm:ss Z}.
     */
    public static Instant parseTime(String s, String errorMessage)
            throws SystemExitException
    {
        try {
            return Instant.ofEpochSecond(Long.parseLong(s));
        }
        catch (NumberFormatException notUnixTime) {
            try {
                return Instant.parse(s);
            }
            catch (DateTimeException notIso) {
                try {
                    return Instant.from(INSTANT_PARSER.parse(s));
                }
                catch (DateTimeException ex) {
                    throw systemExit(errorMessage + ": " + s);
                }
            }
        }
    }
}
