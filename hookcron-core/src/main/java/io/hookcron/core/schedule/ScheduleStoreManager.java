package io.hookcron.core.schedule;

import java.time.Instant;
import java.util.List;

public interface ScheduleStoreManager
{
    ScheduleStore getScheduleStore();

    /**
     * Active schedules with {@code next_execution_at <= now} and no live claim,
     * earliest first.
     */
    List<StoredSchedule> findDueSchedules(Instant now, int limit);

    /**
     * Claims a due schedule if it is still active, still due at {@code expectedNextExecutionAt}
     * and not claimed by someone else. Returns false if another pass won.
     */
    boolean claimSchedule(String scheduleId, Instant expectedNextExecutionAt,
            String claimId, Instant now, Instant claimExpireTime);

    /**
     * Writes back the result of a claimed attempt and appends it to the execution history.
     * Returns false if the claim was lost, for example because the schedule was edited
     * in the meantime. The history row is written either way.
     */
    boolean finishExecution(String scheduleId, String claimId, ScheduleExecutionResult result);
}
