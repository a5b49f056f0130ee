package io.hookcron.client.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableWebhookEmbedFooter.class)
@JsonDeserialize(as = ImmutableWebhookEmbedFooter.class)
public interface WebhookEmbedFooter
{
    String getText();

    @JsonProperty("icon_url")
    Optional<String> getIconUrl();

    static ImmutableWebhookEmbedFooter.Builder builder()
    {
        return ImmutableWebhookEmbedFooter.builder();
    }
}
