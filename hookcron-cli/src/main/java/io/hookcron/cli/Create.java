package io.hookcron.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import com.google.common.io.ByteStreams;
import io.hookcron.client.api.MessageSnapshot;
import io.hookcron.core.HookcronEmbed;
import io.hookcron.core.payload.SnapshotHydrator;
import io.hookcron.core.schedule.ImmutableRecurrenceRequest;
import io.hookcron.core.schedule.RecurrencePattern;
import io.hookcron.core.schedule.RecurrenceRequest;
import io.hookcron.core.schedule.ScheduleRequest;
import io.hookcron.core.schedule.StoredSchedule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.time.Instant;

import static io.hookcron.cli.SystemExitException.systemExit;
import static java.nio.charset.StandardCharsets.UTF_8;

public class Create
    extends EmbedCommand
{
    @Parameter(names = {"--owner"})
    String owner = null;

    @Parameter(names = {"--name"})
    String name = null;

    @Parameter(names = {"-u", "--url"})
    String url = null;

    @Parameter(names = {"--payload"})
    String payloadPath = null;

    @Parameter(names = {"--at"})
    String at = null;

    @Parameter(names = {"-r", "--recurrence"})
    String recurrence = null;

    @Parameter(names = {"--cron"})
    String cron = null;

    @Parameter(names = {"-t", "--timezone"})
    String timezone = null;

    @Parameter(names = {"--max"})
    Integer maxExecutions = null;

    @Override
    public void main()
        throws Exception
    {
        if (args.size() != 0) {
            throw usage(null);
        }
        if (owner == null || name == null || url == null || payloadPath == null) {
            throw usage("--owner, --name, --url and --payload options are required");
        }
        Instant scheduledAt = (at == null) ? Instant.now() : TimeUtil.parseTime(at, "--at must be a time such as 2024-01-01T09:00:00Z");
        RecurrenceRequest recurrenceRequest = buildRecurrence();
        String payloadJson = readPayload();

        try (HookcronEmbed embed = openEmbed()) {
            MessageSnapshot payload = embed.getInjector().getInstance(SnapshotHydrator.class).hydrate(payloadJson);
            ScheduleRequest request = ScheduleRequest.builder()
                .name(name)
                .targetUrl(url)
                .payload(payload)
                .scheduledAt(scheduledAt)
                .recurrence(recurrenceRequest)
                .maxExecutions(Optional.fromNullable(maxExecutions))
                .build();
            StoredSchedule sched = embed.getScheduleManager().create(owner, request);
            ln("Created schedule:");
            printSchedule(sched);
        }
    }

    private RecurrenceRequest buildRecurrence()
    {
        RecurrencePattern pattern;
        if (recurrence != null) {
            pattern = RecurrencePattern.of(recurrence);
        }
        else if (cron != null) {
            pattern = RecurrencePattern.CRON;
        }
        else {
            pattern = RecurrencePattern.ONCE;
        }
        return ImmutableRecurrenceRequest.builder()
            .pattern(pattern)
            .cronExpression(Optional.fromNullable(cron))
            .timezone(Optional.fromNullable(timezone))
            .build();
    }

    private String readPayload()
        throws IOException, SystemExitException
    {
        if (payloadPath.equals("-")) {
            return new String(ByteStreams.toByteArray(in), UTF_8);
        }
        try {
            return new String(Files.readAllBytes(Paths.get(payloadPath)), UTF_8);
        }
        catch (NoSuchFileException ex) {
            throw systemExit("Payload file not found: " + payloadPath);
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " create --owner ID --name NAME --url URL --payload PATH.json [options...]");
        err.println("  Options:");
        err.println("        --owner ID                   owner of the schedule");
        err.println("        --name NAME                  name of the schedule");
        err.println("    -u, --url URL                    webhook URL to deliver to");
        err.println("        --payload PATH.json          saved message (use - to read stdin)");
        err.println("        --at TIME                    first execution time (default: now)");
        err.println("    -r, --recurrence PATTERN         once, daily, weekly, monthly, custom or cron (default: once)");
        err.println("        --cron EXPRESSION            5-field cron expression for custom and cron");
        err.println("    -t, --timezone ZONE              IANA time zone of the recurrence (default: UTC)");
        err.println("        --max N                      stop after N executions");
        showDatabaseOptions();
        err.println("");
        err.println("  Examples:");
        err.println("    $ " + programName + " create --owner 42 --name standup -u https://discord.com/api/webhooks/1/abc \\");
        err.println("        --payload standup.json --at 2024-01-01T09:00:00Z -r weekly -t Asia/Tokyo");
        err.println("");
        return systemExit(error);
    }
}
