package io.hookcron.core.payload;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import io.hookcron.client.ObjectMappers;
import io.hookcron.client.api.EmbedDraft;
import io.hookcron.client.api.EmbedFieldDraft;
import io.hookcron.client.api.ImmutableWebhookEmbed;
import io.hookcron.client.api.ImmutableWebhookMessage;
import io.hookcron.client.api.MessageSnapshot;
import io.hookcron.client.api.WebhookEmbed;
import io.hookcron.client.api.WebhookEmbedAuthor;
import io.hookcron.client.api.WebhookEmbedField;
import io.hookcron.client.api.WebhookEmbedFooter;
import io.hookcron.client.api.WebhookEmbedMedia;
import io.hookcron.client.api.WebhookMessage;

import static java.util.Locale.ENGLISH;

/**
 * Turns a saved {@link MessageSnapshot} into the {@link WebhookMessage} posted to the target.
 *
 * Strings are trimmed and values that end up empty are left out, so the output never
 * carries blank keys. Embeds with nothing to render are dropped.
 */
public class PayloadSerializer
{
    private static final Pattern HEX_COLOR = Pattern.compile("#?[0-9a-fA-F]{6}");

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", ENGLISH).withZone(ZoneOffset.UTC);

    private final ObjectMapper wireMapper;

    public PayloadSerializer()
    {
        this.wireMapper = ObjectMappers.wireObjectMapper();
    }

    public WebhookMessage buildPayload(MessageSnapshot snapshot)
    {
        ImmutableWebhookMessage.Builder builder = WebhookMessage.builder()
            .content(nonEmpty(snapshot.getContent()))
            .username(nonEmpty(snapshot.getUsername()))
            .avatarUrl(nonEmpty(snapshot.getAvatarUrl()))
            .threadName(nonEmpty(snapshot.getThreadName()));

        int flags = calculateFlags(snapshot.getSuppressEmbeds(), snapshot.getSuppressNotifications());
        if (flags != 0) {
            builder.flags(flags);
        }

        for (EmbedDraft embed : snapshot.getEmbeds()) {
            if (!hasRenderableContent(embed)) {
                continue;
            }
            WebhookEmbed transformed = transformEmbed(embed);
            if (!isEmpty(transformed)) {
                builder.addEmbeds(transformed);
            }
        }

        return builder.build();
    }

    public String toJson(WebhookMessage message)
    {
        try {
            return wireMapper.writeValueAsString(message);
        }
        catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize webhook message", ex);
        }
    }

    /**
     * True if the message has nothing to show. Such a message is valid only with attachments.
     */
    public static boolean isEmptyMessage(WebhookMessage message)
    {
        return !message.getContent().isPresent() && message.getEmbeds().isEmpty();
    }

    public static int calculateFlags(boolean suppressEmbeds, boolean suppressNotifications)
    {
        int flags = 0;
        if (suppressEmbeds) {
            flags |= WebhookMessage.FLAG_SUPPRESS_EMBEDS;
        }
        if (suppressNotifications) {
            flags |= WebhookMessage.FLAG_SUPPRESS_NOTIFICATIONS;
        }
        return flags;
    }

    public static boolean hasRenderableContent(EmbedDraft embed)
    {
        boolean hasFields = false;
        for (EmbedFieldDraft field : embed.getFields()) {
            if (!field.getName().trim().isEmpty() || !field.getValue().trim().isEmpty()) {
                hasFields = true;
                break;
            }
        }
        return !embed.getAuthorName().trim().isEmpty()
            || !embed.getTitle().trim().isEmpty()
            || !embed.getDescription().trim().isEmpty()
            || !embed.getFooterText().trim().isEmpty()
            || !embed.getImageUrl().trim().isEmpty()
            || !embed.getThumbnailUrl().trim().isEmpty()
            || hasFields
            || !embed.getTimestampValue().trim().isEmpty();
    }

    WebhookEmbed transformEmbed(EmbedDraft embed)
    {
        ImmutableWebhookEmbed.Builder builder = WebhookEmbed.builder();

        Optional<String> authorName = nonEmpty(embed.getAuthorName());
        if (authorName.isPresent()) {
            builder.author(WebhookEmbedAuthor.builder()
                    .name(authorName.get())
                    .url(nonEmpty(embed.getAuthorUrl()))
                    .iconUrl(nonEmpty(embed.getAuthorIconUrl()))
                    .build());
        }

        builder.title(nonEmpty(embed.getTitle()));
        builder.url(nonEmpty(embed.getUrl()));
        builder.description(nonEmpty(embed.getDescription()));
        builder.color(parseColor(embed.getColor()));
        builder.image(nonEmpty(embed.getImageUrl()).transform(WebhookEmbedMedia::of));
        builder.thumbnail(nonEmpty(embed.getThumbnailUrl()).transform(WebhookEmbedMedia::of));

        Optional<String> footerText = nonEmpty(embed.getFooterText());
        if (footerText.isPresent()) {
            builder.footer(WebhookEmbedFooter.builder()
                    .text(footerText.get())
                    .iconUrl(nonEmpty(embed.getFooterIconUrl()))
                    .build());
        }

        builder.timestamp(parseTimestamp(embed.getTimestampValue()).transform(TIMESTAMP_FORMAT::format));

        for (EmbedFieldDraft field : embed.getFields()) {
            String name = field.getName().trim();
            String value = field.getValue().trim();
            if (!name.isEmpty() && !value.isEmpty()) {
                builder.addFields(WebhookEmbedField.of(name, value, field.getInline()));
            }
        }

        return builder.build();
    }

    private static boolean isEmpty(WebhookEmbed embed)
    {
        return !embed.getAuthor().isPresent()
            && !embed.getTitle().isPresent()
            && !embed.getUrl().isPresent()
            && !embed.getDescription().isPresent()
            && !embed.getColor().isPresent()
            && !embed.getImage().isPresent()
            && !embed.getThumbnail().isPresent()
            && !embed.getFooter().isPresent()
            && !embed.getTimestamp().isPresent()
            && embed.getFields().isEmpty();
    }

    /**
     * Parses {@code #RRGGBB} or {@code RRGGBB}. Anything else is absent.
     */
    public static Optional<Integer> parseColor(String color)
    {
        String trimmed = color.trim();
        if (!HEX_COLOR.matcher(trimmed).matches()) {
            return Optional.absent();
        }
        String hex = trimmed.startsWith("#") ? trimmed.substring(1) : trimmed;
        return Optional.of(Integer.parseInt(hex, 16));
    }

    /**
     * Parses an ISO-8601 instant or offset date-time, or a local date-time which is taken as UTC.
     */
    public static Optional<Instant> parseTimestamp(String value)
    {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.absent();
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(trimmed, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        }
        catch (DateTimeException ex) {
            return Optional.absent();
        }
    }

    static Optional<String> nonEmpty(String value)
    {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.absent();
        }
        return Optional.of(trimmed);
    }
}
