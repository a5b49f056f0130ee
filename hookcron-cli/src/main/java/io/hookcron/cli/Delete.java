package io.hookcron.cli;

import com.beust.jcommander.Parameter;
import io.hookcron.core.HookcronEmbed;
import io.hookcron.core.schedule.ScheduleManager;

import java.io.BufferedReader;
import java.io.InputStreamReader;

import static io.hookcron.cli.SystemExitException.systemExit;
import static java.nio.charset.StandardCharsets.UTF_8;

public class Delete
    extends EmbedCommand
{
    @Parameter(names = {"--force"})
    boolean force = false;

    @Override
    public void main()
        throws Exception
    {
        if (args.size() != 1) {
            throw usage(null);
        }
        String scheduleId = args.get(0);

        try (HookcronEmbed embed = openEmbed()) {
            ScheduleManager manager = embed.getScheduleManager();

            ln("Schedule:");
            printSchedule(manager.getSchedule(scheduleId));

            if (!force) {
                err.print("Are you sure you want to delete this schedule? [y/N]: ");
                BufferedReader stdin = new BufferedReader(new InputStreamReader(in, UTF_8));
                String line = stdin.readLine();
                if (line == null || !(line.trim().equalsIgnoreCase("y") || line.trim().equalsIgnoreCase("yes"))) {
                    throw SystemExitException.canceled();
                }
            }

            manager.delete(scheduleId);
            err.println("Schedule '" + scheduleId + "' is deleted.");
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " delete <id>");
        err.println("  Options:");
        err.println("        --force                      skip y/N prompt");
        showDatabaseOptions();
        return systemExit(error);
    }
}
