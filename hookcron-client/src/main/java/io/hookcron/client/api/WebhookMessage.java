package io.hookcron.client.api;

import java.util.List;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * The JSON object posted to a webhook target. Serialize with
 * {@link io.hookcron.client.ObjectMappers#wireObjectMapper()} so that absent values are omitted.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableWebhookMessage.class)
@JsonDeserialize(as = ImmutableWebhookMessage.class)
public interface WebhookMessage
{
    int FLAG_SUPPRESS_EMBEDS = 1 << 2;
    int FLAG_SUPPRESS_NOTIFICATIONS = 1 << 12;

    Optional<String> getContent();

    Optional<String> getUsername();

    @JsonProperty("avatar_url")
    Optional<String> getAvatarUrl();

    @JsonProperty("thread_name")
    Optional<String> getThreadName();

    Optional<Integer> getFlags();

    List<WebhookEmbed> getEmbeds();

    static ImmutableWebhookMessage.Builder builder()
    {
        return ImmutableWebhookMessage.builder();
    }
}
