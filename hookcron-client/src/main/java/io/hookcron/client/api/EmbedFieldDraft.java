package io.hookcron.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableEmbedFieldDraft.class)
@JsonDeserialize(as = ImmutableEmbedFieldDraft.class)
public interface EmbedFieldDraft
{
    @Value.Default
    default String getId()
    {
        return "";
    }

    @Value.Default
    default String getName()
    {
        return "";
    }

    @Value.Default
    default String getValue()
    {
        return "";
    }

    @Value.Default
    default boolean getInline()
    {
        return false;
    }

    static EmbedFieldDraft of(String name, String value, boolean inline)
    {
        return ImmutableEmbedFieldDraft.builder()
            .name(name)
            .value(value)
            .inline(inline)
            .build();
    }
}
