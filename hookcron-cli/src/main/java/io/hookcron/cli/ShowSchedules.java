package io.hookcron.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import io.hookcron.core.HookcronEmbed;
import io.hookcron.core.schedule.StoredSchedule;

import java.util.List;

import static io.hookcron.cli.SystemExitException.systemExit;

public class ShowSchedules
    extends EmbedCommand
{
    private static final int PAGE_SIZE = 100;

    @Parameter(names = {"--owner"})
    String owner = null;

    @Override
    public void main()
        throws Exception
    {
        if (args.size() != 0) {
            throw usage(null);
        }

        try (HookcronEmbed embed = openEmbed()) {
            ln("Schedules:");
            int count = 0;
            Optional<String> lastId = Optional.absent();
            while (true) {
                List<StoredSchedule> page = embed.getScheduleManager()
                    .getSchedules(Optional.fromNullable(owner), PAGE_SIZE, lastId);
                for (StoredSchedule sched : page) {
                    printSchedule(sched);
                    ln("");
                    count++;
                }
                if (page.size() < PAGE_SIZE) {
                    break;
                }
                lastId = Optional.of(page.get(page.size() - 1).getId());
            }
            ln("%d entries.", count);
        }
        err.println("Use `" + programName + " schedule <id>` to show recent executions of a schedule.");
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " schedules [options...]");
        err.println("  Options:");
        err.println("        --owner ID                   show schedules of this owner only");
        showDatabaseOptions();
        return systemExit(error);
    }
}
