package io.hookcron.cli;

import com.beust.jcommander.Parameter;
import io.hookcron.core.HookcronEmbed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

import static io.hookcron.cli.SystemExitException.systemExit;

public class Server
    extends EmbedCommand
{
    private static final Logger logger = LoggerFactory.getLogger(Server.class);

    @Parameter(names = {"-m", "--memory"})
    boolean memoryDatabase = false;

    @Parameter(names = {"--poll-interval"})
    Integer pollInterval = null;

    @Parameter(names = {"--max-concurrency"})
    Integer maxConcurrency = null;

    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 0) {
            throw usage(null);
        }
        if (database != null && memoryDatabase) {
            throw usage("Setting both --database and --memory is invalid");
        }

        CountDownLatch stopped = new CountDownLatch(1);
        try (HookcronEmbed embed = openEmbed()) {
            Thread shutdownHook = new Thread(() -> {
                logger.info("Shutting down the scheduler");
                embed.getScheduleExecutor().shutdown();
                stopped.countDown();
            }, "shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            embed.getScheduleExecutor().start();
            stopped.await();
        }
    }

    @Override
    protected Properties buildSystemProperties()
        throws IOException, SystemExitException
    {
        Properties props = super.buildSystemProperties();
        if (memoryDatabase) {
            props.setProperty("database.type", "memory");
        }
        if (pollInterval != null) {
            props.setProperty("schedule.poll_interval", Integer.toString(pollInterval));
        }
        if (maxConcurrency != null) {
            props.setProperty("schedule.max_concurrency", Integer.toString(maxConcurrency));
        }
        return props;
    }

    @Override
    protected boolean allowMemoryDatabase()
    {
        return memoryDatabase;
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " server [options...]");
        err.println("  Options:");
        err.println("    -m, --memory                     uses memory database");
        err.println("        --poll-interval SECONDS      interval between polls for due schedules");
        err.println("        --max-concurrency N          number of schedules delivered in parallel");
        showDatabaseOptions();
        return systemExit(error);
    }
}
