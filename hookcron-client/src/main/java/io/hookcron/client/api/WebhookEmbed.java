package io.hookcron.client.api;

import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableWebhookEmbed.class)
@JsonDeserialize(as = ImmutableWebhookEmbed.class)
public interface WebhookEmbed
{
    Optional<WebhookEmbedAuthor> getAuthor();

    Optional<String> getTitle();

    Optional<String> getUrl();

    Optional<String> getDescription();

    Optional<Integer> getColor();

    Optional<WebhookEmbedMedia> getImage();

    Optional<WebhookEmbedMedia> getThumbnail();

    Optional<WebhookEmbedFooter> getFooter();

    Optional<String> getTimestamp();

    List<WebhookEmbedField> getFields();

    static ImmutableWebhookEmbed.Builder builder()
    {
        return ImmutableWebhookEmbed.builder();
    }
}
