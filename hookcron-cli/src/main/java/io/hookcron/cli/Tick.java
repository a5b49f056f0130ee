package io.hookcron.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import io.hookcron.core.HookcronEmbed;
import io.hookcron.core.schedule.DispatchResult;

import java.time.Instant;
import java.util.List;

import static io.hookcron.cli.SystemExitException.systemExit;

public class Tick
    extends EmbedCommand
{
    @Parameter(names = {"--now"})
    String now = null;

    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 0) {
            throw usage(null);
        }
        Optional<Instant> time = parseNow();

        try (HookcronEmbed embed = openEmbed()) {
            List<DispatchResult> results = embed.getScheduleExecutor().tick(time);
            if (results.isEmpty()) {
                out.println("No schedules are due");
                return;
            }
            TablePrinter table = new TablePrinter(out);
            table.row("ID", "NAME", "OUTCOME", "STATUS", "NEXT");
            for (DispatchResult result : results) {
                table.row(
                        result.getScheduleId(),
                        result.getName(),
                        result.getOutcome().toString(),
                        result.getStatusCode().transform(code -> Integer.toString(code)).or(""),
                        result.getContinued() ? result.getNextExecutionAt().transform(Instant::toString).or("") : "finished");
            }
            table.print();
        }
    }

    private Optional<Instant> parseNow()
        throws SystemExitException
    {
        if (now == null) {
            return Optional.absent();
        }
        return Optional.of(TimeUtil.parseTime(now, "--now must be a time such as 2024-01-01T09:00:00Z"));
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " tick [options...]");
        err.println("  Options:");
        err.println("        --now TIME                   deliver schedules due at this time instead of now");
        showDatabaseOptions();
        return systemExit(error);
    }
}
