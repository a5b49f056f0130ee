package io.hookcron.spi;

public enum DeliveryOutcome
{
    // 2xx
    SUCCESS,
    // 4xx. The target refused the request; sending it again would not help.
    REJECTED,
    // 5xx, unexpected status, timeout or network error
    TRANSIENT_FAILURE;
}
