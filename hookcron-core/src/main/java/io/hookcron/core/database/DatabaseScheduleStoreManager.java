package io.hookcron.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.hookcron.client.config.Config;
import io.hookcron.core.repository.ResourceConflictException;
import io.hookcron.core.repository.ResourceLimitExceededException;
import io.hookcron.core.repository.ResourceNotFoundException;
import io.hookcron.core.schedule.ExecutionOutcome;
import io.hookcron.core.schedule.ImmutableStoredSchedule;
import io.hookcron.core.schedule.ImmutableStoredScheduleExecution;
import io.hookcron.core.schedule.ScheduleControlStore;
import io.hookcron.core.schedule.ScheduleDefinition;
import io.hookcron.core.schedule.ScheduleExecutionResult;
import io.hookcron.core.schedule.ScheduleStore;
import io.hookcron.core.schedule.ScheduleStoreManager;
import io.hookcron.core.schedule.StoredSchedule;
import io.hookcron.core.schedule.StoredScheduleExecution;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public class DatabaseScheduleStoreManager
        extends BasicDatabaseStoreManager<DatabaseScheduleStoreManager.Dao>
        implements ScheduleStoreManager
{
    @Inject
    public DatabaseScheduleStoreManager(TransactionManager transactionManager)
    {
        super(Dao.class, transactionManager);
    }

    @Override
    public ScheduleStore getScheduleStore()
    {
        return new DatabaseScheduleStore();
    }

    @Override
    public List<StoredSchedule> findDueSchedules(Instant now, int limit)
    {
        return transaction((handle, dao) -> dao.findDueSchedules(now.getEpochSecond(), limit));
    }

    @Override
    public boolean claimSchedule(String scheduleId, Instant expectedNextExecutionAt,
            String claimId, Instant now, Instant claimExpireTime)
    {
        int n = transaction((handle, dao) -> dao.claimSchedule(scheduleId,
                    expectedNextExecutionAt.getEpochSecond(),
                    claimId,
                    now.getEpochSecond(),
                    claimExpireTime.getEpochSecond()));
        return n > 0;
    }

    @Override
    public boolean finishExecution(String scheduleId, String claimId, ScheduleExecutionResult result)
    {
        return transaction((handle, dao) -> {
            Optional<Instant> next = result.getNextExecutionAt();
            int n = dao.finishClaimedExecution(scheduleId, claimId,
                    result.getExecutedAt().getEpochSecond(),
                    epochSecondOrNull(next),
                    next.isPresent());
            dao.insertExecution(scheduleId,
                    result.getOccurrenceAt().getEpochSecond(),
                    result.getExecutedAt().getEpochSecond(),
                    result.getOutcome().name(),
                    result.getStatusCode().orNull(),
                    result.getMessage().orNull());
            return n > 0;
        });
    }

    private class DatabaseScheduleStore
            implements ScheduleStore
    {
        @Override
        public List<StoredSchedule> getSchedules(int pageSize, Optional<String> lastId)
        {
            return autoCommit((handle, dao) -> dao.getSchedules(pageSize, lastId.or("")));
        }

        @Override
        public List<StoredSchedule> getSchedulesByOwner(String ownerId, int pageSize, Optional<String> lastId)
        {
            return autoCommit((handle, dao) -> dao.getSchedulesByOwner(ownerId, pageSize, lastId.or("")));
        }

        @Override
        public int countSchedulesByOwner(String ownerId)
        {
            return autoCommit((handle, dao) -> dao.countSchedulesByOwner(ownerId));
        }

        @Override
        public StoredSchedule getScheduleById(String scheduleId)
            throws ResourceNotFoundException
        {
            return requiredSchedule(autoCommit((handle, dao) -> dao.getScheduleById(scheduleId)), scheduleId);
        }

        @Override
        public StoredSchedule putSchedule(String ownerId, ScheduleDefinition definition, Instant nextExecutionAt)
        {
            String id = UUID.randomUUID().toString();
            return transaction((handle, dao) -> {
                dao.insertSchedule(id, ownerId,
                        definition.getName(),
                        definition.getPayload().orNull(),
                        definition.getMessageData().orNull(),
                        definition.getTargetUrl(),
                        definition.getScheduledAt().getEpochSecond(),
                        definition.getRecurring(),
                        definition.getRecurrencePattern(),
                        definition.getRecurrenceConfig(),
                        definition.getMaxExecutions().orNull(),
                        nextExecutionAt.getEpochSecond());
                return dao.getScheduleById(id);
            });
        }

        @Override
        public List<StoredScheduleExecution> getExecutions(String scheduleId, int limit)
        {
            return autoCommit((handle, dao) -> dao.getExecutions(scheduleId, limit));
        }

        @Override
        public <T> T lockScheduleById(String scheduleId, ScheduleLockAction<T> func)
            throws ResourceNotFoundException, ResourceConflictException, ResourceLimitExceededException
        {
            return DatabaseScheduleStoreManager.this.<T, ResourceNotFoundException, ResourceConflictException, ResourceLimitExceededException>transaction((handle, dao) -> {
                if (dao.lockScheduleById(scheduleId) == null) {
                    throw ResourceNotFoundException.ofSchedule(scheduleId);
                }
                StoredSchedule schedule = requiredSchedule(dao.getScheduleById(scheduleId), scheduleId);
                return func.call(new DatabaseScheduleControlStore(handle), schedule);
            }, ResourceNotFoundException.class, ResourceConflictException.class, ResourceLimitExceededException.class);
        }
    }

    private static class DatabaseScheduleControlStore
            implements ScheduleControlStore
    {
        private final Dao dao;

        DatabaseScheduleControlStore(Handle handle)
        {
            this.dao = handle.attach(Dao.class);
        }

        @Override
        public StoredSchedule getScheduleById(String scheduleId)
            throws ResourceNotFoundException
        {
            StoredSchedule schedule = dao.getScheduleById(scheduleId);
            if (schedule == null) {
                throw ResourceNotFoundException.ofSchedule(scheduleId);
            }
            return schedule;
        }

        @Override
        public void updateSchedule(String scheduleId, ScheduleDefinition definition, Instant nextExecutionAt, boolean active)
            throws ResourceNotFoundException
        {
            int n = dao.updateSchedule(scheduleId,
                    definition.getName(),
                    definition.getPayload().orNull(),
                    definition.getMessageData().orNull(),
                    definition.getTargetUrl(),
                    definition.getScheduledAt().getEpochSecond(),
                    definition.getRecurring(),
                    definition.getRecurrencePattern(),
                    definition.getRecurrenceConfig(),
                    definition.getMaxExecutions().orNull(),
                    nextExecutionAt.getEpochSecond(),
                    active);
            requireUpdated(n, scheduleId);
        }

        @Override
        public void setActive(String scheduleId, boolean active)
            throws ResourceNotFoundException
        {
            requireUpdated(dao.setActive(scheduleId, active), scheduleId);
        }

        @Override
        public void resetNextExecution(String scheduleId, Instant nextExecutionAt)
            throws ResourceNotFoundException
        {
            requireUpdated(dao.resetNextExecution(scheduleId, nextExecutionAt.getEpochSecond()), scheduleId);
        }

        @Override
        public void deleteSchedule(String scheduleId)
            throws ResourceNotFoundException
        {
            dao.deleteExecutions(scheduleId);
            requireUpdated(dao.deleteSchedule(scheduleId), scheduleId);
        }

        private static void requireUpdated(int n, String scheduleId)
            throws ResourceNotFoundException
        {
            if (n <= 0) {
                throw ResourceNotFoundException.ofSchedule(scheduleId);
            }
        }
    }

    public interface Dao
    {
        @SqlQuery("select * from schedules where id = :id")
        StoredSchedule getScheduleById(@Bind("id") String id);

        @SqlQuery("select * from schedules" +
                " where id > :lastId" +
                " order by id asc" +
                " limit :limit")
        List<StoredSchedule> getSchedules(@Bind("limit") int limit, @Bind("lastId") String lastId);

        @SqlQuery("select * from schedules" +
                " where owner_id = :ownerId" +
                " and id > :lastId" +
                " order by id asc" +
                " limit :limit")
        List<StoredSchedule> getSchedulesByOwner(@Bind("ownerId") String ownerId, @Bind("limit") int limit, @Bind("lastId") String lastId);

        @SqlQuery("select count(*) from schedules where owner_id = :ownerId")
        int countSchedulesByOwner(@Bind("ownerId") String ownerId);

        @SqlQuery("select * from schedules" +
                " where is_active = true" +
                " and next_execution_at <= :now" +
                " and (claim_expire_time is null or claim_expire_time < :now)" +
                " order by next_execution_at asc, id asc" +
                " limit :limit")
        List<StoredSchedule> findDueSchedules(@Bind("now") long now, @Bind("limit") int limit);

        @SqlUpdate("update schedules" +
                " set claim_id = :claimId, claim_expire_time = :expire" +
                " where id = :id" +
                " and is_active = true" +
                " and next_execution_at = :expected" +
                " and (claim_expire_time is null or claim_expire_time < :now)")
        int claimSchedule(@Bind("id") String id, @Bind("expected") long expected,
                @Bind("claimId") String claimId, @Bind("now") long now, @Bind("expire") long expire);

        @SqlUpdate("update schedules" +
                " set execution_count = execution_count + 1," +
                " last_executed_at = :executedAt," +
                " next_execution_at = :next," +
                " is_active = :active," +
                " claim_id = null, claim_expire_time = null," +
                " updated_at = current_timestamp" +
                " where id = :id" +
                " and claim_id = :claimId")
        int finishClaimedExecution(@Bind("id") String id, @Bind("claimId") String claimId,
                @Bind("executedAt") long executedAt, @Bind("next") Long next, @Bind("active") boolean active);

        @SqlUpdate("insert into schedule_executions" +
                " (schedule_id, occurrence_at, executed_at, outcome, status_code, message)" +
                " values (:scheduleId, :occurrenceAt, :executedAt, :outcome, :statusCode, :message)")
        void insertExecution(@Bind("scheduleId") String scheduleId,
                @Bind("occurrenceAt") long occurrenceAt, @Bind("executedAt") long executedAt,
                @Bind("outcome") String outcome, @Bind("statusCode") Integer statusCode,
                @Bind("message") String message);

        @SqlQuery("select * from schedule_executions" +
                " where schedule_id = :scheduleId" +
                " order by id desc" +
                " limit :limit")
        List<StoredScheduleExecution> getExecutions(@Bind("scheduleId") String scheduleId, @Bind("limit") int limit);

        @SqlUpdate("insert into schedules" +
                " (id, owner_id, name, payload, message_data, target_url, scheduled_at," +
                " is_recurring, recurrence_pattern, recurrence_config, max_executions," +
                " execution_count, next_execution_at, is_active, created_at, updated_at)" +
                " values (:id, :ownerId, :name, :payload, :messageData, :targetUrl, :scheduledAt," +
                " :recurring, :recurrencePattern, :recurrenceConfig, :maxExecutions," +
                " 0, :nextExecutionAt, true, current_timestamp, current_timestamp)")
        void insertSchedule(@Bind("id") String id, @Bind("ownerId") String ownerId, @Bind("name") String name,
                @Bind("payload") String payload, @Bind("messageData") String messageData,
                @Bind("targetUrl") String targetUrl, @Bind("scheduledAt") long scheduledAt,
                @Bind("recurring") boolean recurring, @Bind("recurrencePattern") String recurrencePattern,
                @Bind("recurrenceConfig") Config recurrenceConfig, @Bind("maxExecutions") Integer maxExecutions,
                @Bind("nextExecutionAt") long nextExecutionAt);

        @SqlQuery("select id from schedules" +
                " where id = :id" +
                " for update")
        String lockScheduleById(@Bind("id") String id);

        @SqlUpdate("update schedules" +
                " set name = :name, payload = :payload, message_data = :messageData," +
                " target_url = :targetUrl, scheduled_at = :scheduledAt," +
                " is_recurring = :recurring, recurrence_pattern = :recurrencePattern," +
                " recurrence_config = :recurrenceConfig, max_executions = :maxExecutions," +
                " next_execution_at = :nextExecutionAt, is_active = :active," +
                " claim_id = null, claim_expire_time = null," +
                " updated_at = current_timestamp" +
                " where id = :id")
        int updateSchedule(@Bind("id") String id, @Bind("name") String name,
                @Bind("payload") String payload, @Bind("messageData") String messageData,
                @Bind("targetUrl") String targetUrl, @Bind("scheduledAt") long scheduledAt,
                @Bind("recurring") boolean recurring, @Bind("recurrencePattern") String recurrencePattern,
                @Bind("recurrenceConfig") Config recurrenceConfig, @Bind("maxExecutions") Integer maxExecutions,
                @Bind("nextExecutionAt") long nextExecutionAt, @Bind("active") boolean active);

        @SqlUpdate("update schedules" +
                " set is_active = :active, claim_id = null, claim_expire_time = null, updated_at = current_timestamp" +
                " where id = :id")
        int setActive(@Bind("id") String id, @Bind("active") boolean active);

        @SqlUpdate("update schedules" +
                " set next_execution_at = :next, claim_id = null, claim_expire_time = null, updated_at = current_timestamp" +
                " where id = :id")
        int resetNextExecution(@Bind("id") String id, @Bind("next") long next);

        @SqlUpdate("delete from schedule_executions where schedule_id = :id")
        int deleteExecutions(@Bind("id") String id);

        @SqlUpdate("delete from schedules where id = :id")
        int deleteSchedule(@Bind("id") String id);
    }

    static class StoredScheduleMapper
            implements RowMapper<StoredSchedule>
    {
        private final ConfigMapper cfm;

        StoredScheduleMapper(ConfigMapper cfm)
        {
            this.cfm = cfm;
        }

        @Override
        public StoredSchedule map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredSchedule.builder()
                .id(r.getString("id"))
                .ownerId(r.getString("owner_id"))
                .name(r.getString("name"))
                .payload(getOptionalString(r, "payload"))
                .messageData(getOptionalString(r, "message_data"))
                .targetUrl(r.getString("target_url"))
                .scheduledAt(Instant.ofEpochSecond(r.getLong("scheduled_at")))
                .recurring(r.getBoolean("is_recurring"))
                .recurrencePattern(r.getString("recurrence_pattern"))
                .recurrenceConfig(cfm.fromResultSetOrEmpty(r, "recurrence_config"))
                .maxExecutions(getOptionalInt(r, "max_executions"))
                .executionCount(r.getInt("execution_count"))
                .nextExecutionAt(getOptionalEpochSecond(r, "next_execution_at"))
                .lastExecutedAt(getOptionalEpochSecond(r, "last_executed_at"))
                .active(r.getBoolean("is_active"))
                .claimId(getOptionalString(r, "claim_id"))
                .claimExpireTime(getOptionalEpochSecond(r, "claim_expire_time"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .updatedAt(getTimestampInstant(r, "updated_at"))
                .build();
        }
    }

    static class StoredScheduleExecutionMapper
            implements RowMapper<StoredScheduleExecution>
    {
        @Override
        public StoredScheduleExecution map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredScheduleExecution.builder()
                .id(r.getLong("id"))
                .scheduleId(r.getString("schedule_id"))
                .occurrenceAt(Instant.ofEpochSecond(r.getLong("occurrence_at")))
                .executedAt(Instant.ofEpochSecond(r.getLong("executed_at")))
                .outcome(ExecutionOutcome.valueOf(r.getString("outcome")))
                .statusCode(getOptionalInt(r, "status_code"))
                .message(getOptionalString(r, "message"))
                .build();
        }
    }
}
