package io.hookcron.spi;

import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
public interface DeliveryRequest
{
    String getUrl();

    /**
     * Serialized message object. Sent as the request body, or as the
     * {@code payload_json} part when attachments are present.
     */
    String getPayloadJson();

    List<DeliveryAttachment> getAttachments();

    static ImmutableDeliveryRequest.Builder builder()
    {
        return ImmutableDeliveryRequest.builder();
    }
}
