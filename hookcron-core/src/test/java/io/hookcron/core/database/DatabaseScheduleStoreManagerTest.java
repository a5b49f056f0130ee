package io.hookcron.core.database;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import com.google.common.base.Optional;
import io.hookcron.core.schedule.ExecutionOutcome;
import io.hookcron.core.schedule.ScheduleControl;
import io.hookcron.core.schedule.ScheduleExecutionResult;
import io.hookcron.core.schedule.ScheduleStore;
import io.hookcron.core.schedule.ScheduleStoreManager;
import io.hookcron.core.schedule.StoredSchedule;
import io.hookcron.core.schedule.StoredScheduleExecution;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.hookcron.core.database.DatabaseTestingUtils.assertNotFound;
import static io.hookcron.core.database.DatabaseTestingUtils.cronDefinition;
import static io.hookcron.core.database.DatabaseTestingUtils.onceDefinition;
import static io.hookcron.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

public class DatabaseScheduleStoreManagerTest
{
    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    private DatabaseFactory factory;
    private ScheduleStoreManager manager;
    private ScheduleStore store;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        manager = factory.getScheduleStoreManager();
        store = manager.getScheduleStore();
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    private StoredSchedule put(String ownerId, String name, Instant at)
            throws Exception
    {
        return factory.begin(() -> store.putSchedule(ownerId, onceDefinition(name, at), at));
    }

    @Test
    public void putAndGet()
        throws Exception
    {
        StoredSchedule stored = put("alice", "s1", T0);

        assertThat(stored.getOwnerId(), is("alice"));
        assertThat(stored.getName(), is("s1"));
        assertThat(stored.getActive(), is(true));
        assertThat(stored.getExecutionCount(), is(0));
        assertThat(stored.getNextExecutionAt(), is(Optional.of(T0)));
        assertThat(stored.getLastExecutedAt(), is(Optional.absent()));
        assertThat(stored.getClaimId(), is(Optional.absent()));
        assertThat(stored.getPayload(), is(Optional.of("{\"content\":\"hello\"}")));
        assertThat(stored.getMessageData(), is(Optional.absent()));
        assertThat(stored.getRecurrenceConfig().isEmpty(), is(true));

        StoredSchedule fetched = factory.begin(() -> store.getScheduleById(stored.getId()));
        assertThat(fetched, is(stored));
    }

    @Test
    public void recurrenceConfigIsStored()
        throws Exception
    {
        StoredSchedule stored = factory.begin(() ->
                store.putSchedule("alice", cronDefinition("c", T0, "0 9 * * *", Optional.of(3)), T0));

        assertThat(stored.getRecurring(), is(true));
        assertThat(stored.getRecurrencePattern(), is("cron"));
        assertThat(stored.getRecurrenceConfig().get("cron_expression", String.class), is("0 9 * * *"));
        assertThat(stored.getMaxExecutions(), is(Optional.of(3)));
    }

    @Test
    public void getNotFound()
    {
        assertNotFound(() -> factory.begin(() -> store.getScheduleById("no-such-id")));
        assertNotFound(() -> factory.begin(() -> store.lockScheduleById("no-such-id", (control, schedule) -> schedule)));
    }

    @Test
    public void listByOwnerWithPaging()
        throws Exception
    {
        put("alice", "a1", T0);
        put("alice", "a2", T0);
        put("alice", "a3", T0);
        put("bob", "b1", T0);

        assertThat(factory.begin(() -> store.countSchedulesByOwner("alice")), is(3));
        assertThat(factory.begin(() -> store.countSchedulesByOwner("carol")), is(0));

        List<StoredSchedule> first = factory.begin(() -> store.getSchedulesByOwner("alice", 2, Optional.absent()));
        assertThat(first, hasSize(2));
        List<StoredSchedule> rest = factory.begin(() -> store.getSchedulesByOwner("alice", 2, Optional.of(first.get(1).getId())));
        assertThat(rest, hasSize(1));
        assertThat(rest.get(0).getOwnerId(), is("alice"));

        assertThat(factory.begin(() -> store.getSchedules(100, Optional.absent())), hasSize(4));
    }

    @Test
    public void findDueSchedulesSkipsFutureInactiveAndClaimed()
        throws Exception
    {
        StoredSchedule late = put("alice", "late", T0.minusSeconds(120));
        put("alice", "due", T0);
        put("alice", "future", T0.plusSeconds(60));
        StoredSchedule paused = put("alice", "paused", T0.minusSeconds(60));
        StoredSchedule claimed = put("alice", "claimed", T0.minusSeconds(30));

        factory.begin(() -> store.lockScheduleById(paused.getId(),
                    (control, schedule) -> new ScheduleControl(control, schedule).disableSchedule()));
        assertThat(factory.begin(() -> manager.claimSchedule(claimed.getId(), claimed.getNextExecutionAt().get(),
                        "other", T0, T0.plusSeconds(300))), is(true));

        List<StoredSchedule> found = factory.begin(() -> manager.findDueSchedules(T0, 100));
        List<String> names = new ArrayList<>();
        for (StoredSchedule s : found) {
            names.add(s.getName());
        }
        assertThat(names, contains("late", "due"));

        List<StoredSchedule> limited = factory.begin(() -> manager.findDueSchedules(T0, 1));
        assertThat(limited.get(0).getId(), is(late.getId()));

        // the claim is selectable again after its lease
        List<StoredSchedule> afterLease = factory.begin(() -> manager.findDueSchedules(T0.plusSeconds(301), 100));
        assertThat(afterLease, hasSize(4));
    }

    @Test
    public void claimIsExclusive()
        throws Exception
    {
        StoredSchedule s = put("alice", "s", T0);
        Instant expected = s.getNextExecutionAt().get();

        assertThat(factory.begin(() -> manager.claimSchedule(s.getId(), expected, "first", T0, T0.plusSeconds(300))), is(true));
        assertThat(factory.begin(() -> manager.claimSchedule(s.getId(), expected, "second", T0, T0.plusSeconds(300))), is(false));

        // a different expected time means the schedule moved on
        assertThat(factory.begin(() -> manager.claimSchedule(s.getId(), expected.plusSeconds(1), "third", T0.plusSeconds(400), T0.plusSeconds(700))), is(false));

        // expired lease
        assertThat(factory.begin(() -> manager.claimSchedule(s.getId(), expected, "fourth", T0.plusSeconds(301), T0.plusSeconds(601))), is(true));
        assertThat(factory.begin(() -> store.getScheduleById(s.getId())).getClaimId(), is(Optional.of("fourth")));
    }

    @Test
    public void concurrentClaimsHaveOneWinner()
        throws Exception
    {
        StoredSchedule s = put("alice", "s", T0);
        Instant expected = s.getNextExecutionAt().get();

        int contenders = 8;
        ExecutorService threads = Executors.newFixedThreadPool(contenders);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String claimId = "claim-" + i;
                Callable<Boolean> claim = () -> {
                    start.await();
                    return factory.begin(() -> manager.claimSchedule(s.getId(), expected, claimId, T0, T0.plusSeconds(300)));
                };
                futures.add(threads.submit(claim));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> future : futures) {
                if (future.get()) {
                    winners++;
                }
            }
            assertThat(winners, is(1));
        }
        finally {
            threads.shutdownNow();
        }
    }

    @Test
    public void finishExecutionAdvancesAndRecordsHistory()
        throws Exception
    {
        StoredSchedule s = factory.begin(() ->
                store.putSchedule("alice", cronDefinition("c", T0, "* * * * *", Optional.absent()), T0));
        factory.begin(() -> manager.claimSchedule(s.getId(), T0, "claim", T0, T0.plusSeconds(300)));

        ScheduleExecutionResult result = ScheduleExecutionResult.builder()
            .occurrenceAt(T0)
            .executedAt(T0.plusSeconds(2))
            .outcome(ExecutionOutcome.SUCCESS)
            .statusCode(204)
            .nextExecutionAt(T0.plusSeconds(60))
            .build();
        assertThat(factory.begin(() -> manager.finishExecution(s.getId(), "claim", result)), is(true));

        StoredSchedule updated = factory.begin(() -> store.getScheduleById(s.getId()));
        assertThat(updated.getExecutionCount(), is(1));
        assertThat(updated.getLastExecutedAt(), is(Optional.of(T0.plusSeconds(2))));
        assertThat(updated.getNextExecutionAt(), is(Optional.of(T0.plusSeconds(60))));
        assertThat(updated.getActive(), is(true));
        assertThat(updated.getClaimId(), is(Optional.absent()));
        assertThat(updated.getClaimExpireTime(), is(Optional.absent()));

        List<StoredScheduleExecution> history = factory.begin(() -> store.getExecutions(s.getId(), 10));
        assertThat(history, hasSize(1));
        assertThat(history.get(0).getOccurrenceAt(), is(T0));
        assertThat(history.get(0).getOutcome(), is(ExecutionOutcome.SUCCESS));
        assertThat(history.get(0).getStatusCode(), is(Optional.of(204)));
        assertThat(history.get(0).getMessage(), is(Optional.absent()));
    }

    @Test
    public void finishWithoutNextExecutionDeactivates()
        throws Exception
    {
        StoredSchedule s = put("alice", "s", T0);
        factory.begin(() -> manager.claimSchedule(s.getId(), T0, "claim", T0, T0.plusSeconds(300)));

        ScheduleExecutionResult result = ScheduleExecutionResult.builder()
            .occurrenceAt(T0)
            .executedAt(T0)
            .outcome(ExecutionOutcome.TRANSIENT_FAILURE)
            .statusCode(503)
            .message("503 Service Unavailable")
            .build();
        factory.begin(() -> manager.finishExecution(s.getId(), "claim", result));

        StoredSchedule updated = factory.begin(() -> store.getScheduleById(s.getId()));
        assertThat(updated.getActive(), is(false));
        assertThat(updated.getNextExecutionAt(), is(Optional.absent()));
        assertThat(updated.getExecutionCount(), is(1));
        assertThat(factory.begin(() -> manager.findDueSchedules(T0.plusSeconds(3600), 100)), is(empty()));
    }

    @Test
    public void finishAfterLostClaimKeepsRowButRecordsHistory()
        throws Exception
    {
        StoredSchedule s = put("alice", "s", T0);
        factory.begin(() -> manager.claimSchedule(s.getId(), T0, "claim", T0, T0.plusSeconds(300)));

        // an edit while executing clears the claim
        factory.begin(() -> store.lockScheduleById(s.getId(),
                    (control, schedule) -> new ScheduleControl(control, schedule)
                        .update(onceDefinition("edited", T0.plusSeconds(3600)), T0.plusSeconds(3600), true)));

        ScheduleExecutionResult result = ScheduleExecutionResult.builder()
            .occurrenceAt(T0)
            .executedAt(T0)
            .outcome(ExecutionOutcome.SUCCESS)
            .statusCode(200)
            .build();
        assertThat(factory.begin(() -> manager.finishExecution(s.getId(), "claim", result)), is(false));

        StoredSchedule updated = factory.begin(() -> store.getScheduleById(s.getId()));
        assertThat(updated.getName(), is("edited"));
        assertThat(updated.getActive(), is(true));
        assertThat(updated.getExecutionCount(), is(0));
        assertThat(updated.getNextExecutionAt(), is(Optional.of(T0.plusSeconds(3600))));
        assertThat(factory.begin(() -> store.getExecutions(s.getId(), 10)), hasSize(1));
    }

    @Test
    public void resetNextExecutionClearsClaim()
        throws Exception
    {
        StoredSchedule s = put("alice", "s", T0.plusSeconds(3600));
        factory.begin(() -> manager.claimSchedule(s.getId(), T0.plusSeconds(3600), "claim", T0.plusSeconds(3600), T0.plusSeconds(3900)));

        StoredSchedule reset = factory.begin(() -> store.lockScheduleById(s.getId(),
                    (control, schedule) -> new ScheduleControl(control, schedule).resetNextExecution(T0)));

        assertThat(reset.getNextExecutionAt(), is(Optional.of(T0)));
        assertThat(reset.getClaimId(), is(Optional.absent()));
        assertThat(factory.begin(() -> manager.findDueSchedules(T0, 100)), hasSize(1));
    }

    @Test
    public void deleteRemovesHistory()
        throws Exception
    {
        StoredSchedule s = put("alice", "s", T0);
        factory.begin(() -> manager.claimSchedule(s.getId(), T0, "claim", T0, T0.plusSeconds(300)));
        factory.begin(() -> manager.finishExecution(s.getId(), "claim", ScheduleExecutionResult.builder()
                    .occurrenceAt(T0)
                    .executedAt(T0)
                    .outcome(ExecutionOutcome.SKIPPED)
                    .message("Schedule has no message")
                    .build()));

        factory.begin(() -> {
            store.lockScheduleById(s.getId(), (control, schedule) -> {
                new ScheduleControl(control, schedule).delete();
                return null;
            });
        });

        assertNotFound(() -> factory.begin(() -> store.getScheduleById(s.getId())));
        assertThat(factory.begin(() -> store.getExecutions(s.getId(), 10)), is(empty()));
    }
}
