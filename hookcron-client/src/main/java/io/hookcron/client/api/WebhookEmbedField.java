package io.hookcron.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableWebhookEmbedField.class)
@JsonDeserialize(as = ImmutableWebhookEmbedField.class)
public interface WebhookEmbedField
{
    String getName();

    String getValue();

    boolean getInline();

    static WebhookEmbedField of(String name, String value, boolean inline)
    {
        return ImmutableWebhookEmbedField.builder()
            .name(name)
            .value(value)
            .inline(inline)
            .build();
    }
}
