package io.hookcron.spi;

import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface DeliveryResult
{
    DeliveryOutcome getOutcome();

    Optional<Integer> getStatusCode();

    Optional<String> getMessage();

    default boolean isSuccess()
    {
        return getOutcome() == DeliveryOutcome.SUCCESS;
    }

    static DeliveryResult success(int statusCode)
    {
        return ImmutableDeliveryResult.builder()
            .outcome(DeliveryOutcome.SUCCESS)
            .statusCode(statusCode)
            .build();
    }

    static DeliveryResult rejected(int statusCode, String message)
    {
        return ImmutableDeliveryResult.builder()
            .outcome(DeliveryOutcome.REJECTED)
            .statusCode(statusCode)
            .message(message)
            .build();
    }

    static DeliveryResult transientFailure(Optional<Integer> statusCode, String message)
    {
        return ImmutableDeliveryResult.builder()
            .outcome(DeliveryOutcome.TRANSIENT_FAILURE)
            .statusCode(statusCode)
            .message(message)
            .build();
    }
}
