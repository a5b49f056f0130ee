package io.hookcron.core;

import com.google.common.base.Optional;

/**
 * Receives errors that escape the schedule poller or one of its workers, with the id of the
 * schedule being delivered when there is one. Nothing is reported unless an implementation
 * is bound.
 */
public interface ErrorReporter
{
    void reportUncaughtError(Throwable error, Optional<String> scheduleId);

    static ErrorReporter empty()
    {
        return (error, scheduleId) -> { };
    }
}
