package io.hookcron.cli;

import com.beust.jcommander.Parameter;
import io.hookcron.core.HookcronEmbed;
import io.hookcron.core.schedule.ScheduleManager;
import io.hookcron.core.schedule.StoredScheduleExecution;

import java.util.List;

import static io.hookcron.cli.SystemExitException.systemExit;
import static io.hookcron.cli.TimeUtil.formatTime;

public class ShowSchedule
    extends EmbedCommand
{
    @Parameter(names = {"-n", "--executions"})
    int executions = 20;

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
            printSchedule(manager.getSchedule(scheduleId));
            ln("");

            List<StoredScheduleExecution> history = manager.getExecutions(scheduleId, executions);
            ln("Executions:");
            if (history.isEmpty()) {
                ln("  (none)");
                return;
            }
            TablePrinter table = new TablePrinter(out);
            table.row("  OCCURRENCE", "EXECUTED", "OUTCOME", "STATUS", "MESSAGE");
            for (StoredScheduleExecution exec : history) {
                table.row(
                        "  " + formatTime(exec.getOccurrenceAt()),
                        formatTime(exec.getExecutedAt()),
                        exec.getOutcome().toString(),
                        exec.getStatusCode().transform(code -> Integer.toString(code)).or(""),
                        exec.getMessage().or(""));
            }
            table.print();
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " schedule <id> [options...]");
        err.println("  Options:");
        err.println("    -n, --executions N               number of recent executions to show (default: 20)");
        showDatabaseOptions();
        return systemExit(error);
    }
}
