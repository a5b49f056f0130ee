package io.hookcron.cli;

import io.hookcron.core.HookcronEmbed;
import io.hookcron.core.schedule.StoredSchedule;

import static io.hookcron.cli.SystemExitException.systemExit;

public class Reset
    extends EmbedCommand
{
    @Override
    public void main()
        throws Exception
    {
        if (args.size() != 1) {
            throw usage(null);
        }

        try (HookcronEmbed embed = openEmbed()) {
            StoredSchedule sched = embed.getScheduleManager().resetToNow(args.get(0));
            ln("Schedule is due now:");
            printSchedule(sched);
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " reset <id>");
        err.println("  Moves the next execution of an active schedule to now.");
        err.println("  Options:");
        showDatabaseOptions();
        return systemExit(error);
    }
}
