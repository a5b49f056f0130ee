package io.hookcron.cli;

import io.hookcron.core.HookcronEmbed;
import io.hookcron.core.schedule.StoredSchedule;

import static io.hookcron.cli.SystemExitException.systemExit;

public class EnableSchedule
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
            StoredSchedule sched = embed.getScheduleManager().setActive(args.get(0), true);
            ln("Enabled schedule:");
            printSchedule(sched);
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " enable <id>");
        err.println("  Options:");
        showDatabaseOptions();
        return systemExit(error);
    }
}
