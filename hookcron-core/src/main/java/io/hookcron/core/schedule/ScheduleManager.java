package io.hookcron.core.schedule;

import java.io.IOException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.hookcron.client.api.StoredAttachment;
import io.hookcron.core.database.TransactionManager;
import io.hookcron.core.payload.SnapshotHydrator;
import io.hookcron.core.repository.ResourceConflictException;
import io.hookcron.core.repository.ResourceLimitExceededException;
import io.hookcron.core.repository.ResourceNotFoundException;
import io.hookcron.core.storage.AttachmentStorageManager;
import io.hookcron.spi.AttachmentStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Create, edit and delete schedules on behalf of their owners.
 *
 * Validation errors are thrown as {@link io.hookcron.client.config.ConfigException}.
 */
public class ScheduleManager
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleManager.class);

    private final ScheduleStoreManager sm;
    private final TransactionManager tm;
    private final ScheduleValidator validator;
    private final ScheduleConfig scheduleConfig;
    private final SnapshotHydrator hydrator;
    private final AttachmentStorageManager storageManager;

    @Inject
    public ScheduleManager(
            ScheduleStoreManager sm,
            TransactionManager tm,
            ScheduleValidator validator,
            ScheduleConfig scheduleConfig,
            SnapshotHydrator hydrator,
            AttachmentStorageManager storageManager)
    {
        this.sm = sm;
        this.tm = tm;
        this.validator = validator;
        this.scheduleConfig = scheduleConfig;
        this.hydrator = hydrator;
        this.storageManager = storageManager;
    }

    public StoredSchedule create(String ownerId, ScheduleRequest request)
        throws ScheduleQuotaExceededException
    {
        ScheduleDefinition definition = validator.validate(request, Instant.now());
        return tm.begin(() -> {
            ScheduleStore store = sm.getScheduleStore();
            int count = store.countSchedulesByOwner(ownerId);
            if (count >= scheduleConfig.getMaxPerOwner()) {
                throw new ScheduleQuotaExceededException(ownerId, count, scheduleConfig.getMaxPerOwner());
            }
            StoredSchedule stored = store.putSchedule(ownerId, definition, definition.getScheduledAt());
            logger.info("Created schedule {} ({}) of owner {}. First execution at {}",
                    stored.getId(), stored.getName(), ownerId, definition.getScheduledAt());
            return stored;
        }, ScheduleQuotaExceededException.class);
    }

    /**
     * Replaces the definition of a schedule. The next execution is moved to the requested time
     * and the schedule is activated again unless it has reached its execution limit.
     */
    public StoredSchedule update(String scheduleId, ScheduleRequest request)
        throws ResourceNotFoundException, ResourceConflictException
    {
        ScheduleDefinition definition = validator.validate(request, Instant.now());
        return lock(scheduleId, (store, schedule) -> {
            boolean exhausted = definition.getMaxExecutions().isPresent()
                && schedule.getExecutionCount() >= definition.getMaxExecutions().get();
            StoredSchedule updated = new ScheduleControl(store, schedule)
                .update(definition, definition.getScheduledAt(), !exhausted);
            logger.info("Updated schedule {} ({}). Next execution at {}",
                    scheduleId, updated.getName(), updated.getNextExecutionAt().orNull());
            return updated;
        });
    }

    public StoredSchedule setActive(String scheduleId, boolean active)
        throws ResourceNotFoundException, ResourceConflictException
    {
        return lock(scheduleId, (store, schedule) -> {
            ScheduleControl control = new ScheduleControl(store, schedule);
            if (!active) {
                return control.disableSchedule();
            }
            if (schedule.isExhausted()) {
                throw new ResourceConflictException(scheduleId, String.format(
                            "Schedule %s has reached its execution limit of %d",
                            scheduleId, schedule.getMaxExecutions().get()));
            }
            if (!schedule.getNextExecutionAt().isPresent()) {
                throw new ResourceConflictException(scheduleId, "Schedule " + scheduleId + " has no next execution time. Update it to set one");
            }
            return control.enableSchedule();
        });
    }

    /**
     * Makes an active schedule due immediately.
     */
    public StoredSchedule resetToNow(String scheduleId)
        throws ResourceNotFoundException, ResourceConflictException
    {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        return lock(scheduleId, (store, schedule) -> {
            if (!schedule.getActive()) {
                throw new ResourceConflictException(scheduleId, "Schedule " + scheduleId + " is not active");
            }
            StoredSchedule reset = new ScheduleControl(store, schedule).resetNextExecution(now);
            logger.info("Reset next execution of schedule {} to {}", scheduleId, now);
            return reset;
        });
    }

    /**
     * Deletes a schedule and its history, then releases its attachments. Failures of the
     * attachment storage are logged and don't fail the deletion.
     */
    public StoredSchedule delete(String scheduleId)
        throws ResourceNotFoundException, ResourceConflictException
    {
        StoredSchedule deleted = lock(scheduleId, (store, schedule) -> {
            new ScheduleControl(store, schedule).delete();
            return schedule;
        });
        logger.info("Deleted schedule {} ({})", scheduleId, deleted.getName());
        releaseAttachments(deleted);
        return deleted;
    }

    public StoredSchedule getSchedule(String scheduleId)
        throws ResourceNotFoundException
    {
        return tm.autoCommit(() -> sm.getScheduleStore().getScheduleById(scheduleId), ResourceNotFoundException.class);
    }

    public List<StoredSchedule> getSchedules(Optional<String> ownerId, int pageSize, Optional<String> lastId)
    {
        return tm.autoCommit(() -> {
            ScheduleStore store = sm.getScheduleStore();
            if (ownerId.isPresent()) {
                return store.getSchedulesByOwner(ownerId.get(), pageSize, lastId);
            }
            return store.getSchedules(pageSize, lastId);
        });
    }

    public List<StoredScheduleExecution> getExecutions(String scheduleId, int limit)
        throws ResourceNotFoundException
    {
        return tm.autoCommit(() -> {
            ScheduleStore store = sm.getScheduleStore();
            store.getScheduleById(scheduleId);
            return store.getExecutions(scheduleId, limit);
        }, ResourceNotFoundException.class);
    }

    private <T> T lock(String scheduleId, ScheduleStore.ScheduleLockAction<T> func)
        throws ResourceNotFoundException, ResourceConflictException
    {
        try {
            return tm.<T, ResourceNotFoundException, ResourceConflictException, ResourceLimitExceededException>begin(
                    () -> sm.getScheduleStore().lockScheduleById(scheduleId, func),
                    ResourceNotFoundException.class, ResourceConflictException.class, ResourceLimitExceededException.class);
        }
        catch (ResourceLimitExceededException ex) {
            throw new IllegalStateException("Unexpected limit error while updating schedule " + scheduleId, ex);
        }
    }

    private void releaseAttachments(StoredSchedule schedule)
    {
        if (!schedule.getPayload().isPresent()) {
            return;
        }
        List<StoredAttachment> files = hydrator.hydrate(schedule.getPayload().get()).getFiles();
        if (files.isEmpty()) {
            return;
        }
        AttachmentStorage storage = storageManager.getStorage();
        for (StoredAttachment file : files) {
            try {
                storage.delete(file.getStoragePath());
            }
            catch (IOException | RuntimeException ex) {
                logger.warn("Failed to release attachment {} of deleted schedule {}",
                        file.getStoragePath(), schedule.getId(), ex);
            }
        }
    }
}
