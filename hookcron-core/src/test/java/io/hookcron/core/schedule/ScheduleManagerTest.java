package io.hookcron.core.schedule;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import com.google.common.base.Optional;
import io.hookcron.client.api.MessageSnapshot;
import io.hookcron.client.api.StoredAttachment;
import io.hookcron.client.config.ConfigElement;
import io.hookcron.client.config.ConfigException;
import io.hookcron.core.HookcronEmbed;
import io.hookcron.spi.DeliveryResult;
import io.hookcron.spi.DeliverySender;
import io.hookcron.standards.StandardsModule;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import static io.hookcron.core.database.DatabaseTestingUtils.assertConflict;
import static io.hookcron.core.database.DatabaseTestingUtils.assertNotFound;
import static io.hookcron.core.database.DatabaseTestingUtils.createConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ScheduleManagerTest
{
    private static final String WEBHOOK = "https://discord.com/api/webhooks/123/abc";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Rule
    public ExpectedException exception = ExpectedException.none();

    private HookcronEmbed embed;
    private ScheduleManager manager;
    private ScheduleExecutor executor;
    private Instant inOneHour;

    @Before
    public void setUp()
    {
        DeliverySender sender = mock(DeliverySender.class);
        when(sender.send(any())).thenReturn(DeliveryResult.success(204));

        embed = new HookcronEmbed.Bootstrap()
            .setSystemConfig(ConfigElement.copyOf(createConfig()
                        .set("schedule.max_per_owner", 2)
                        .set("attachment.local.root", folder.getRoot().toString())))
            .addModules(new StandardsModule())
            .overrideModulesWith(binder -> binder.bind(DeliverySender.class).toInstance(sender))
            .initialize();
        manager = embed.getScheduleManager();
        executor = embed.getScheduleExecutor();
        inOneHour = Instant.now().plus(1, ChronoUnit.HOURS).truncatedTo(ChronoUnit.SECONDS);
    }

    @After
    public void destroy()
    {
        embed.close();
    }

    private static MessageSnapshot message(String content)
    {
        return MessageSnapshot.builder().content(content).build();
    }

    private ImmutableScheduleRequest.Builder request(String name)
    {
        return ScheduleRequest.builder()
            .name(name)
            .targetUrl(WEBHOOK)
            .payload(message("hello"))
            .scheduledAt(inOneHour);
    }

    @Test
    public void createOnceSchedule()
        throws Exception
    {
        StoredSchedule created = manager.create("alice", request("  reminder ").build());

        assertThat(created.getName(), is("reminder"));
        assertThat(created.getOwnerId(), is("alice"));
        assertThat(created.getRecurring(), is(false));
        assertThat(created.getRecurrencePattern(), is("once"));
        assertThat(created.getNextExecutionAt(), is(Optional.of(inOneHour)));
        assertThat(created.getActive(), is(true));

        assertThat(manager.getSchedule(created.getId()), is(created));
        assertThat(manager.getSchedules(Optional.of("alice"), 10, Optional.absent()), hasSize(1));
        assertThat(manager.getSchedules(Optional.of("bob"), 10, Optional.absent()), is(empty()));
    }

    @Test
    public void createWeeklyScheduleInTimeZone()
        throws Exception
    {
        // Monday 2030-01-07 09:30 in Tokyo
        Instant at = Instant.parse("2030-01-07T00:30:00Z");
        StoredSchedule created = manager.create("alice", request("weekly")
                .scheduledAt(at)
                .recurrence(RecurrenceRequest.of(RecurrencePattern.WEEKLY, Optional.of("Asia/Tokyo")))
                .build());

        assertThat(created.getRecurring(), is(true));
        assertThat(created.getRecurrencePattern(), is("cron"));
        assertThat(created.getRecurrenceConfig().get("cron_expression", String.class), is("30 9 * * 1"));
        assertThat(created.getRecurrenceConfig().get("timezone", String.class), is("Asia/Tokyo"));
        assertThat(created.getNextExecutionAt(), is(Optional.of(at)));
    }

    @Test
    public void rejectsInvalidRequests()
    {
        assertInvalid(request("x").targetUrl("https://example.com/api/webhooks/1/t").build(), "is not allowed");
        assertInvalid(request("x").targetUrl("http://discord.com/api/webhooks/1/t").build(), "must use https");
        assertInvalid(request(" ").build(), "name must not be empty");
        assertInvalid(request("x").payload(message("   ")).build(), "Message must have content");
        assertInvalid(request("x").maxExecutions(0).build(), "max_executions");
        assertInvalid(request("x").scheduledAt(Instant.now().minus(1, ChronoUnit.DAYS)).build(), "in the past");
        assertInvalid(request("x").recurrence(RecurrenceRequest.cron("61 * * * *", Optional.absent())).build(), "minute");
        assertInvalid(request("x").recurrence(RecurrenceRequest.of(RecurrencePattern.CRON, Optional.absent())).build(), "cron expression is required");
        assertInvalid(request("x").recurrence(RecurrenceRequest.of(RecurrencePattern.DAILY, Optional.of("Mars/Base"))).build(), "Unknown time zone");
    }

    private void assertInvalid(ScheduleRequest request, String messagePart)
    {
        try {
            manager.create("alice", request);
            fail("Expected ConfigException containing " + messagePart);
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString(messagePart));
        }
        catch (ScheduleQuotaExceededException ex) {
            throw new AssertionError(ex);
        }
    }

    @Test
    public void ownerQuotaIsEnforced()
        throws Exception
    {
        manager.create("alice", request("one").build());
        manager.create("alice", request("two").build());
        manager.create("bob", request("three").build());

        exception.expect(ScheduleQuotaExceededException.class);
        manager.create("alice", request("four").build());
    }

    @Test
    public void updateReplacesDefinitionAndReactivates()
        throws Exception
    {
        StoredSchedule created = manager.create("alice", request("once").build());
        StoredSchedule disabled = manager.setActive(created.getId(), false);
        assertThat(disabled.getActive(), is(false));

        Instant later = inOneHour.plus(1, ChronoUnit.DAYS);
        StoredSchedule updated = manager.update(created.getId(), request("daily")
                .scheduledAt(later)
                .recurrence(RecurrenceRequest.of(RecurrencePattern.DAILY, Optional.absent()))
                .build());

        assertThat(updated.getName(), is("daily"));
        assertThat(updated.getRecurring(), is(true));
        assertThat(updated.getActive(), is(true));
        assertThat(updated.getNextExecutionAt(), is(Optional.of(later)));
    }

    @Test
    public void exhaustedScheduleCanNotBeEnabled()
        throws Exception
    {
        StoredSchedule created = manager.create("alice", request("limited")
                .scheduledAt(Instant.now().truncatedTo(ChronoUnit.SECONDS))
                .recurrence(RecurrenceRequest.cron("* * * * *", Optional.absent()))
                .maxExecutions(1)
                .build());

        List<DispatchResult> results = executor.tick(Optional.of(Instant.now().plusSeconds(1)));
        assertThat(results, hasSize(1));

        StoredSchedule finished = manager.getSchedule(created.getId());
        assertThat(finished.getActive(), is(false));
        assertThat(finished.isExhausted(), is(true));
        assertConflict(() -> manager.setActive(created.getId(), true));
        assertConflict(() -> manager.resetToNow(created.getId()));
        assertThat(manager.getExecutions(created.getId(), 10), hasSize(1));

        // raising the limit activates it again
        StoredSchedule updated = manager.update(created.getId(), request("limited")
                .recurrence(RecurrenceRequest.cron("* * * * *", Optional.absent()))
                .maxExecutions(5)
                .build());
        assertThat(updated.getActive(), is(true));
    }

    @Test
    public void resetMakesScheduleDue()
        throws Exception
    {
        StoredSchedule created = manager.create("alice", request("later").build());

        StoredSchedule reset = manager.resetToNow(created.getId());
        assertThat(reset.getNextExecutionAt().get().isAfter(inOneHour), is(false));

        List<DispatchResult> results = executor.tick(Optional.absent());
        assertThat(results, hasSize(1));
        assertThat(results.get(0).getScheduleId(), is(created.getId()));
    }

    @Test
    public void deleteRemovesScheduleAndAttachments()
        throws Exception
    {
        Path upload = folder.newFolder("uploads").toPath().resolve("a.txt");
        Files.write(upload, "abc".getBytes(StandardCharsets.UTF_8));

        StoredSchedule created = manager.create("alice", request("files")
                .payload(MessageSnapshot.builder()
                    .addFiles(StoredAttachment.builder()
                        .name("a.txt")
                        .size(3)
                        .storagePath("uploads/a.txt")
                        .build())
                    .build())
                .build());

        manager.delete(created.getId());

        assertThat(Files.exists(upload), is(false));
        assertNotFound(() -> manager.getSchedule(created.getId()));
        assertNotFound(() -> manager.getExecutions(created.getId(), 10));
        assertNotFound(() -> manager.delete(created.getId()));
    }
}
