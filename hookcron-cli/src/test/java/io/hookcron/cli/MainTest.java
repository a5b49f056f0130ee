package io.hookcron.cli;

import com.google.common.collect.ImmutableMap;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;

public class MainTest
{
    private static final Pattern ID_LINE = Pattern.compile("^  id: (\\S+)$", Pattern.MULTILINE);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private MockWebServer mockWebServer;
    private Path configFile;
    private Path payloadFile;
    private String webhookUrl;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setUp()
            throws Exception
    {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        HttpUrl url = mockWebServer.url("/api/webhooks/123/secret-token");
        webhookUrl = url.toString();

        Path root = folder.getRoot().toPath();
        configFile = root.resolve("config");
        Files.write(configFile, (""
                    + "database.type = h2\n"
                    + "database.path = " + root.resolve("db").toString().replace("\\", "/") + "\n"
                    + "attachment.local.root = " + root.resolve("attachments").toString().replace("\\", "/") + "\n"
                    + "webhook.allowed_hosts = " + url.host() + "\n"
                    + "webhook.allow_insecure = true\n"
                    ).getBytes(UTF_8));

        payloadFile = root.resolve("payload.json");
        Files.write(payloadFile, "{\"content\":\"hello from cli\",\"username\":\"bot\"}".getBytes(UTF_8));
    }

    @After
    public void tearDown()
            throws Exception
    {
        mockWebServer.shutdown();
    }

    private int cli(String... args)
    {
        return cliWithInput("", args);
    }

    private int cliWithInput(String stdin, String... args)
    {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        Main main = new Main(
                ImmutableMap.of("HOOKCRON_CONFIG_HOME", folder.getRoot().toPath().resolve("home").toString()),
                new PrintStream(out, true),
                new PrintStream(err, true),
                new ByteArrayInputStream(stdin.getBytes(UTF_8)));
        return main.cli(args);
    }

    private String stdout()
    {
        return new String(out.toByteArray(), UTF_8);
    }

    private String stderr()
    {
        return new String(err.toByteArray(), UTF_8);
    }

    private String createOnce()
    {
        int code = cli("create", "-c", configFile.toString(),
                "--owner", "42",
                "--name", "greeting",
                "--url", webhookUrl,
                "--payload", payloadFile.toString());
        assertThat(stderr(), code, is(0));
        Matcher m = ID_LINE.matcher(stdout());
        assertThat(m.find(), is(true));
        return m.group(1);
    }

    @Test
    public void noArgumentsShowsUsage()
    {
        assertThat(cli(), is(0));
        assertThat(stderr(), containsString("Usage: hookcron <command> [options...]"));
    }

    @Test
    public void unknownCommand()
    {
        assertThat(cli("no-such-command"), is(1));
        assertThat(stderr(), containsString("error: available commands are: "));
    }

    @Test
    public void databaseIsRequired()
    {
        assertThat(cli("tick"), is(1));
        assertThat(stderr(), containsString("error: --database, or database.type in the configuration is required"));
    }

    @Test
    public void unknownLogLevel()
    {
        assertThat(cli("tick", "-l", "loud", "-c", configFile.toString()), is(1));
        assertThat(stderr(), containsString("error: Unknown log level 'loud'"));
    }

    @Test
    public void createAndDeliver()
            throws Exception
    {
        String id = createOnce();
        assertThat(stdout(), containsString("  recurrence: once"));
        assertThat(stdout(), containsString("  active: true"));

        mockWebServer.enqueue(new MockResponse().setResponseCode(204));

        String now = Instant.now().plusSeconds(60).toString();
        assertThat(stderr(), cli("tick", "-c", configFile.toString(), "--now", now), is(0));
        assertThat(stdout(), containsString(id));
        assertThat(stdout(), containsString("SUCCESS"));
        assertThat(stdout(), containsString("finished"));

        RecordedRequest request = mockWebServer.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request, notNullValue());
        assertThat(request.getMethod(), is("POST"));
        assertThat(request.getPath(), containsString("/api/webhooks/123/secret-token"));
        assertThat(request.getBody().readUtf8(), containsString("hello from cli"));

        // nothing is left
        assertThat(cli("tick", "-c", configFile.toString(), "--now", now), is(0));
        assertThat(stdout(), containsString("No schedules are due"));

        assertThat(cli("schedule", "-c", configFile.toString(), id), is(0));
        assertThat(stdout(), containsString("  active: false"));
        assertThat(stdout(), containsString("SUCCESS"));
        assertThat(stdout(), containsString("204"));
    }

    @Test
    public void createWeekly()
    {
        int code = cli("create", "-c", configFile.toString(),
                "--owner", "42",
                "--name", "standup",
                "--url", webhookUrl,
                "--payload", payloadFile.toString(),
                "--at", Instant.now().plusSeconds(3600).toString(),
                "-r", "weekly",
                "-t", "Asia/Tokyo",
                "--max", "3");
        assertThat(stderr(), code, is(0));
        assertThat(stdout(), containsString("  recurrence: cron \""));
        assertThat(stdout(), containsString("Asia/Tokyo"));
        assertThat(stdout(), containsString("  executions: 0 / 3"));
    }

    @Test
    public void invalidRequestIsReported()
    {
        int code = cli("create", "-c", configFile.toString(),
                "--owner", "42",
                "--name", "bad",
                "--url", "https://example.com/hook",
                "--payload", payloadFile.toString());
        assertThat(code, is(1));
        assertThat(stderr(), containsString("error: Webhook host 'example.com' is not allowed"));
    }

    @Test
    public void listDisableEnableAndReset()
    {
        String id = createOnce();

        assertThat(cli("schedules", "-c", configFile.toString(), "--owner", "42"), is(0));
        assertThat(stdout(), containsString("  id: " + id));
        assertThat(stdout(), containsString("1 entries."));

        assertThat(cli("schedules", "-c", configFile.toString(), "--owner", "other"), is(0));
        assertThat(stdout(), containsString("0 entries."));

        assertThat(cli("disable", "-c", configFile.toString(), id), is(0));
        assertThat(stdout(), containsString("  active: false"));

        assertThat(cli("reset", "-c", configFile.toString(), id), is(1));
        assertThat(stderr(), containsString("is not active"));

        assertThat(cli("enable", "-c", configFile.toString(), id), is(0));
        assertThat(stdout(), containsString("  active: true"));

        assertThat(cli("reset", "-c", configFile.toString(), id), is(0));
        assertThat(stdout(), containsString("Schedule is due now:"));
    }

    @Test
    public void deleteAsksForConfirmation()
    {
        String id = createOnce();

        assertThat(cliWithInput("n\n", "delete", "-c", configFile.toString(), id), is(1));
        assertThat(stderr(), containsString("error: canceled."));

        assertThat(cliWithInput("y\n", "delete", "-c", configFile.toString(), id), is(0));
        assertThat(stderr(), containsString("Schedule '" + id + "' is deleted."));

        assertThat(cli("schedule", "-c", configFile.toString(), id), is(1));
        assertThat(stderr(), containsString("Resource does not exist"));
    }

    @Test
    public void migrateCheckAfterRun()
            throws IOException
    {
        assertThat(cli("migrate", "run", "-c", configFile.toString()), is(0));
        assertThat(stdout(), containsString("Migrations successfully finished"));

        assertThat(cli("migrate", "check", "-c", configFile.toString()), is(0));
        assertThat(stdout(), containsString("No update"));

        assertThat(cli("migrate", "run", "-c", configFile.toString()), is(0));
        assertThat(stdout(), is(not(containsString("Migrations successfully finished"))));
        assertThat(stdout(), containsString("No update"));
    }

    @Test
    public void formatExceptionMessageJoinsCauses()
    {
        Exception ex = new IllegalStateException("outer", new IOException("inner"));
        assertThat(Main.formatExceptionMessage(ex), is("outer: inner"));
        assertThat(Main.formatExceptionMessage(new RuntimeException()), is("RuntimeException"));
    }
}
