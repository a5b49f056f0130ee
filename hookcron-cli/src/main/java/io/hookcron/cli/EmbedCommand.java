package io.hookcron.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigElement;
import io.hookcron.core.HookcronEmbed;
import io.hookcron.core.schedule.ScheduleValidator;
import io.hookcron.core.schedule.StoredSchedule;
import io.hookcron.standards.StandardsModule;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * A command that opens the schedule database in this process.
 */
public abstract class EmbedCommand
    extends Command
{
    @Parameter(names = {"-o", "--database"})
    protected String database = null;

    protected HookcronEmbed openEmbed()
        throws IOException, SystemExitException
    {
        Properties props = buildSystemProperties();
        return new HookcronEmbed.Bootstrap()
            .addModules(new StandardsModule())
            .setSystemConfig(ConfigElement.fromProperties(props))
            .initialize();
    }

    protected Properties buildSystemProperties()
        throws IOException, SystemExitException
    {
        Properties props = loadSystemProperties();
        if (database != null) {
            props.setProperty("database.type", "h2");
            props.setProperty("database.path", Paths.get(database).toAbsolutePath().toString());
        }
        else if (!props.containsKey("database.type") && !allowMemoryDatabase()) {
            throw usage("--database, or database.type in the configuration is required");
        }
        return props;
    }

    protected boolean allowMemoryDatabase()
    {
        return false;
    }

    protected void ln(String format, Object... args)
    {
        out.println(String.format(format, args));
    }

    protected void printSchedule(StoredSchedule sched)
    {
        ln("  id: %s", sched.getId());
        ln("  name: %s", sched.getName());
        ln("  owner: %s", sched.getOwnerId());
        ln("  target: %s", sched.getTargetUrl());
        ln("  recurrence: %s", formatRecurrence(sched));
        ln("  executions: %s", sched.getMaxExecutions().transform(max -> sched.getExecutionCount() + " / " + max)
                .or(Integer.toString(sched.getExecutionCount())));
        ln("  active: %s", sched.getActive());
        ln("  next execution: %s", sched.getNextExecutionAt().transform(TimeUtil::formatTime).or(""));
        ln("  last executed: %s", sched.getLastExecutedAt().transform(TimeUtil::formatTime).or(""));
    }

    private static String formatRecurrence(StoredSchedule sched)
    {
        if (!sched.getRecurring()) {
            return sched.getRecurrencePattern();
        }
        Config rc = sched.getRecurrenceConfig();
        Optional<String> cron = rc.getOptional(ScheduleValidator.CRON_EXPRESSION_KEY, String.class);
        Optional<String> timezone = rc.getOptional(ScheduleValidator.TIMEZONE_KEY, String.class);
        StringBuilder sb = new StringBuilder(sched.getRecurrencePattern());
        if (cron.isPresent()) {
            sb.append(" \"").append(cron.get()).append("\"");
        }
        if (timezone.isPresent()) {
            sb.append(" ").append(timezone.get());
        }
        return sb.toString();
    }

    protected void showDatabaseOptions()
    {
        err.println("    -o, --database DIR               path to H2 database");
        Main.showCommonOptions(env, err);
    }
}
