package io.hookcron.standards.delivery;

import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigException;
import io.hookcron.spi.DeliverySender;
import org.immutables.value.Value;

@Value.Immutable
public interface DeliveryConfig
{
    String DEFAULT_USER_AGENT = "hookcron (https://github.com/hookcron/hookcron, 0.1)";

    int getTimeout();  // seconds

    String getUserAgent();

    // appends ?wait=true so that the target reports errors in the response
    boolean getWaitForResult();

    // maximum number of response body characters kept in an error message
    int getMaxErrorMessageSize();

    static ImmutableDeliveryConfig.Builder builder()
    {
        return ImmutableDeliveryConfig.builder();
    }

    static DeliveryConfig convertFrom(Config config)
    {
        int timeout = config.get("delivery.timeout", int.class, DeliverySender.DEFAULT_TIMEOUT);
        if (timeout <= 0) {
            throw ConfigException.notPositive("delivery.timeout", timeout);
        }
        return builder()
            .timeout(timeout)
            .userAgent(config.get("delivery.user_agent", String.class, DEFAULT_USER_AGENT))
            .waitForResult(config.get("delivery.wait", boolean.class, true))
            .maxErrorMessageSize(config.get("delivery.max_error_message_size", int.class, 512))
            .build();
    }
}
