package io.hookcron.client.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableWebhookEmbedAuthor.class)
@JsonDeserialize(as = ImmutableWebhookEmbedAuthor.class)
public interface WebhookEmbedAuthor
{
    String getName();

    Optional<String> getUrl();

    @JsonProperty("icon_url")
    Optional<String> getIconUrl();

    static ImmutableWebhookEmbedAuthor.Builder builder()
    {
        return ImmutableWebhookEmbedAuthor.builder();
    }
}
