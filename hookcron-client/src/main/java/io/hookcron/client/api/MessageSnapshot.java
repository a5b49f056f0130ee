package io.hookcron.client.api;

import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Editable state of a message as the composer saved it. Stored with each schedule and turned
 * into a {@link WebhookMessage} when the schedule fires.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableMessageSnapshot.class)
@JsonDeserialize(as = ImmutableMessageSnapshot.class)
public interface MessageSnapshot
{
    @Value.Default
    default String getContent()
    {
        return "";
    }

    @Value.Default
    default String getUsername()
    {
        return "";
    }

    @Value.Default
    default String getAvatarUrl()
    {
        return "";
    }

    @Value.Default
    default String getThreadName()
    {
        return "";
    }

    @Value.Default
    default boolean getSuppressEmbeds()
    {
        return false;
    }

    @Value.Default
    default boolean getSuppressNotifications()
    {
        return false;
    }

    List<EmbedDraft> getEmbeds();

    List<StoredAttachment> getFiles();

    Optional<String> getWebhookUrl();

    static ImmutableMessageSnapshot.Builder builder()
    {
        return ImmutableMessageSnapshot.builder();
    }

    static MessageSnapshot empty()
    {
        return builder().build();
    }
}
