package io.hookcron.spi;

/**
 * Posts a message to a webhook target.
 *
 * Implementations make exactly one attempt with a bounded timeout and report the
 * outcome instead of throwing on HTTP or network errors.
 */
public interface DeliverySender
{
    // seconds, used when delivery.timeout is not set
    int DEFAULT_TIMEOUT = 10;

    DeliveryResult send(DeliveryRequest request);
}
