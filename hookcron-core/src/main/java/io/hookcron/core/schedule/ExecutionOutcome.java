package io.hookcron.core.schedule;

import io.hookcron.spi.DeliveryOutcome;

public enum ExecutionOutcome
{
    SUCCESS,
    REJECTED,
    TRANSIENT_FAILURE,
    // the message could not be built so nothing was sent
    SKIPPED;

    public static ExecutionOutcome of(DeliveryOutcome outcome)
    {
        switch (outcome) {
        case SUCCESS:
            return SUCCESS;
        case REJECTED:
            return REJECTED;
        case TRANSIENT_FAILURE:
            return TRANSIENT_FAILURE;
        default:
            throw new IllegalArgumentException("Unknown delivery outcome: " + outcome);
        }
    }
}
