package io.hookcron.client.api;

import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableEmbedDraft.class)
@JsonDeserialize(as = ImmutableEmbedDraft.class)
public interface EmbedDraft
{
    String DEFAULT_COLOR = "#5865F2";

    @Value.Default
    default String getId()
    {
        return "";
    }

    @Value.Default
    default String getAuthorName()
    {
        return "";
    }

    @Value.Default
    default String getAuthorUrl()
    {
        return "";
    }

    @Value.Default
    default String getAuthorIconUrl()
    {
        return "";
    }

    @Value.Default
    default String getTitle()
    {
        return "";
    }

    @Value.Default
    default String getUrl()
    {
        return "";
    }

    @Value.Default
    default String getDescription()
    {
        return "";
    }

    @Value.Default
    default String getColor()
    {
        return DEFAULT_COLOR;
    }

    @Value.Default
    default String getImageUrl()
    {
        return "";
    }

    @Value.Default
    default String getThumbnailUrl()
    {
        return "";
    }

    @Value.Default
    default String getFooterText()
    {
        return "";
    }

    @Value.Default
    default String getFooterIconUrl()
    {
        return "";
    }

    // datetime-local value of the editor, or any ISO-8601 date-time
    @Value.Default
    default String getTimestampValue()
    {
        return "";
    }

    List<EmbedFieldDraft> getFields();

    static ImmutableEmbedDraft.Builder builder()
    {
        return ImmutableEmbedDraft.builder();
    }
}
