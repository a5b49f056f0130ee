package io.hookcron.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * A file uploaded with the message. Only the reference is stored with a schedule;
 * the content is read from attachment storage when the schedule fires.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableStoredAttachment.class)
@JsonDeserialize(as = ImmutableStoredAttachment.class)
public interface StoredAttachment
{
    String getName();

    long getSize();

    @Value.Default
    default String getMimeType()
    {
        return "application/octet-stream";
    }

    String getStoragePath();

    Optional<Integer> getOriginalIndex();

    static ImmutableStoredAttachment.Builder builder()
    {
        return ImmutableStoredAttachment.builder();
    }
}
