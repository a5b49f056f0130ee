package io.hookcron.core.schedule;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.hookcron.client.config.ConfigException;
import io.hookcron.core.ErrorReporter;
import io.hookcron.core.database.TransactionManager;
import io.hookcron.spi.DeliveryRequest;
import io.hookcron.spi.DeliveryResult;
import io.hookcron.spi.DeliverySender;
import io.hookcron.spi.NextFireTime;
import io.hookcron.spi.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires due schedules.
 *
 * Each {@link #tick(Optional)} selects due schedules, claims them one by one and executes the
 * claimed ones on a bounded worker pool. A schedule claimed by another dispatcher is skipped.
 * After the attempt, successful or not, the execution count is incremented and the schedule is
 * either moved to its next fire time or deactivated.
 */
public class ScheduleExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleExecutor.class);

    private final ScheduleStoreManager sm;
    private final SchedulerManager srm;
    private final TransactionManager tm;
    private final DeliveryRequestBuilder requestBuilder;
    private final DeliverySender sender;
    private final ScheduleConfig scheduleConfig;
    private ScheduledExecutorService executor;
    private ExecutorService workers;

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    @Inject
    public ScheduleExecutor(
            ScheduleStoreManager sm,
            SchedulerManager srm,
            TransactionManager tm,
            DeliveryRequestBuilder requestBuilder,
            DeliverySender sender,
            ScheduleConfig scheduleConfig)
    {
        this.sm = sm;
        this.srm = srm;
        this.tm = tm;
        this.requestBuilder = requestBuilder;
        this.sender = sender;
        this.scheduleConfig = scheduleConfig;
    }

    @VisibleForTesting
    synchronized boolean isStarted()
    {
        return executor != null;
    }

    public synchronized void start()
    {
        if (scheduleConfig.getEnabled()) {
            if (executor == null) {
                executor = Executors.newScheduledThreadPool(1,
                        new ThreadFactoryBuilder()
                        .setDaemon(true)
                        .setNameFormat("scheduler-%d")
                        .build()
                        );
                workers = newWorkerPool();
                executor.scheduleWithFixedDelay(() -> runSchedules(),
                        1, scheduleConfig.getPollInterval(), TimeUnit.SECONDS);
                logger.info("Started scheduler. Polling every {} seconds with {} workers",
                        scheduleConfig.getPollInterval(), scheduleConfig.getMaxConcurrency());
            }
        }
        else {
            logger.debug("Scheduler is disabled.");
        }
    }

    public synchronized void shutdown()
    {
        if (executor != null) {
            executor.shutdown();
            workers.shutdown();
            try {
                if (!workers.awaitTermination(scheduleConfig.getClaimLease(), TimeUnit.SECONDS)) {
                    logger.warn("Schedule workers didn't finish within {} seconds", scheduleConfig.getClaimLease());
                }
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for schedule workers to finish");
            }
            executor = null;
            workers = null;
        }
    }

    private void runSchedules()
    {
        try {
            tick(Optional.absent());
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Scheduling will be retried.", t);
            errorReporter.reportUncaughtError(t, Optional.absent());
        }
    }

    /**
     * Runs one dispatcher pass.
     *
     * @param now current time, or absent to use the system clock
     * @return one result for each schedule this pass claimed
     */
    public List<DispatchResult> tick(Optional<Instant> now)
    {
        Instant time = (now.isPresent() ? now.get() : Instant.now()).truncatedTo(ChronoUnit.SECONDS);

        List<StoredSchedule> due = tm.begin(() -> sm.findDueSchedules(time, scheduleConfig.getBatchSize()));
        if (due.isEmpty()) {
            logger.debug("No schedules are due at {}", time);
            return ImmutableList.of();
        }

        for (StoredSchedule schedule : due) {
            if (schedule.getClaimId().isPresent()) {
                logger.warn("Claim of schedule {} expired at {}. It will be claimed again",
                        schedule.getId(), schedule.getClaimExpireTime().orNull());
            }
        }

        ExecutorService pool;
        boolean temporaryPool;
        synchronized (this) {
            temporaryPool = workers == null;
            pool = temporaryPool ? newWorkerPool() : workers;
        }

        List<DispatchResult> results = new ArrayList<>();
        try {
            List<Future<Optional<DispatchResult>>> futures = new ArrayList<>();
            for (StoredSchedule schedule : due) {
                futures.add(pool.submit(() -> dispatch(schedule, time)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    Optional<DispatchResult> result = futures.get(i).get();
                    if (result.isPresent()) {
                        results.add(result.get());
                    }
                }
                catch (ExecutionException ex) {
                    logger.error("Failed to dispatch schedule {}", due.get(i).getId(), ex.getCause());
                    errorReporter.reportUncaughtError(ex.getCause(), Optional.of(due.get(i).getId()));
                }
            }
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for schedule workers. {} of {} results collected", results.size(), due.size());
        }
        finally {
            if (temporaryPool) {
                pool.shutdown();
            }
        }

        logSummary(time, due.size(), results);
        return results;
    }

    @VisibleForTesting
    Optional<DispatchResult> dispatch(StoredSchedule schedule, Instant now)
    {
        Instant occurrence = schedule.getNextExecutionAt().get();
        String claimId = UUID.randomUUID().toString();
        Instant claimExpireTime = now.plusSeconds(scheduleConfig.getClaimLease());

        boolean claimed = tm.begin(() -> sm.claimSchedule(schedule.getId(), occurrence, claimId, now, claimExpireTime));
        if (!claimed) {
            logger.debug("Schedule {} is claimed by another dispatcher. Skipping", schedule.getId());
            return Optional.absent();
        }

        Optional<String> terminalReason = Optional.absent();
        Optional<Scheduler> scheduler = Optional.absent();
        if (schedule.getRecurring()) {
            try {
                scheduler = Optional.of(srm.getScheduler(schedule));
            }
            catch (ConfigException ex) {
                logger.warn("Recurrence of schedule {} can't be evaluated. It will be deactivated after this attempt: {}",
                        schedule.getId(), ex.getMessage());
                terminalReason = Optional.of("Invalid recurrence: " + ex.getMessage());
            }
        }

        ExecutionOutcome outcome;
        Optional<Integer> statusCode;
        Optional<String> message;
        try {
            DeliveryRequest request = requestBuilder.build(schedule);
            DeliveryResult result = sender.send(request);
            outcome = ExecutionOutcome.of(result.getOutcome());
            statusCode = result.getStatusCode();
            message = result.getMessage();
            if (result.isSuccess()) {
                logger.info("Delivered schedule {} ({})", schedule.getId(), schedule.getName());
            }
            else {
                logger.warn("Delivery of schedule {} ({}) failed with {}: {}",
                        schedule.getId(), schedule.getName(), outcome, message.or(""));
            }
        }
        catch (PayloadUnavailableException ex) {
            logger.warn("Skipping schedule {} ({}): {}", schedule.getId(), schedule.getName(), ex.getMessage());
            outcome = ExecutionOutcome.SKIPPED;
            statusCode = Optional.absent();
            message = Optional.of(ex.getMessage());
        }
        catch (RuntimeException ex) {
            // still finished below, which releases the claim
            logger.error("Delivery of schedule {} ({}) failed with an unexpected error", schedule.getId(), schedule.getName(), ex);
            outcome = ExecutionOutcome.TRANSIENT_FAILURE;
            statusCode = Optional.absent();
            message = Optional.of("Unexpected error: " + ex);
        }

        if (terminalReason.isPresent()) {
            message = Optional.of(message.isPresent() ? terminalReason.get() + "; " + message.get() : terminalReason.get());
        }

        Optional<Instant> next = nextExecution(schedule, scheduler, now);

        ScheduleExecutionResult result = ScheduleExecutionResult.builder()
            .occurrenceAt(occurrence)
            .executedAt(now)
            .outcome(outcome)
            .statusCode(statusCode)
            .message(message)
            .nextExecutionAt(next)
            .build();

        boolean finished = tm.begin(() -> sm.finishExecution(schedule.getId(), claimId, result));
        if (!finished) {
            logger.warn("Schedule {} was modified while it was executing. Keeping the modification", schedule.getId());
        }
        else if (!next.isPresent()) {
            logger.info("Schedule {} ({}) is finished after {} executions",
                    schedule.getId(), schedule.getName(), schedule.getExecutionCount() + 1);
        }

        return Optional.of(DispatchResult.builder()
                .scheduleId(schedule.getId())
                .name(schedule.getName())
                .outcome(outcome)
                .statusCode(statusCode)
                .continued(next.isPresent())
                .nextExecutionAt(next)
                .build());
    }

    private Optional<Instant> nextExecution(StoredSchedule schedule, Optional<Scheduler> scheduler, Instant now)
    {
        if (!scheduler.isPresent() || ScheduleValidator.ONCE_PATTERN.equals(schedule.getRecurrencePattern())) {
            return Optional.absent();
        }
        Optional<Integer> max = schedule.getMaxExecutions();
        if (max.isPresent() && schedule.getExecutionCount() + 1 >= max.get()) {
            return Optional.absent();
        }
        NextFireTime next;
        try {
            next = scheduler.get().nextFireTime(now);
        }
        catch (RuntimeException ex) {
            logger.error("Failed to compute the next fire time of schedule {}. It will be deactivated", schedule.getId(), ex);
            return Optional.absent();
        }
        if (next.isTerminal()) {
            logger.info("Recurrence of schedule {} has no more fire times", schedule.getId());
        }
        return next.getTime();
    }

    private ExecutorService newWorkerPool()
    {
        return Executors.newFixedThreadPool(scheduleConfig.getMaxConcurrency(),
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("schedule-worker-%d")
                .build()
                );
    }

    private static void logSummary(Instant time, int dueCount, List<DispatchResult> results)
    {
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (DispatchResult result : results) {
            switch (result.getOutcome()) {
            case SUCCESS:
                succeeded++;
                break;
            case SKIPPED:
                skipped++;
                break;
            default:
                failed++;
                break;
            }
        }
        logger.info("Tick at {}: {} due, {} claimed, {} delivered, {} failed, {} skipped",
                time, dueCount, results.size(), succeeded, failed, skipped);
    }
}
