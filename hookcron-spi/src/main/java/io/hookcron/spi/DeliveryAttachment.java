package io.hookcron.spi;

import org.immutables.value.Value;

@Value.Immutable
public interface DeliveryAttachment
{
    String getFileName();

    String getContentType();

    byte[] getContent();

    static DeliveryAttachment of(String fileName, String contentType, byte[] content)
    {
        return ImmutableDeliveryAttachment.builder()
            .fileName(fileName)
            .contentType(contentType)
            .content(content)
            .build();
    }
}
