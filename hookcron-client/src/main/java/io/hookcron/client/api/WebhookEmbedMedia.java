package io.hookcron.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * {@code image} and {@code thumbnail} of an embed.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableWebhookEmbedMedia.class)
@JsonDeserialize(as = ImmutableWebhookEmbedMedia.class)
public interface WebhookEmbedMedia
{
    String getUrl();

    static WebhookEmbedMedia of(String url)
    {
        return ImmutableWebhookEmbedMedia.builder().url(url).build();
    }
}
