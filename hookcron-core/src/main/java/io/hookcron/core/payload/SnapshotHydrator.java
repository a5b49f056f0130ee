package io.hookcron.core.payload;

import java.io.IOException;
import java.util.Collections;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.hookcron.client.api.EmbedDraft;
import io.hookcron.client.api.EmbedFieldDraft;
import io.hookcron.client.api.ImmutableEmbedDraft;
import io.hookcron.client.api.ImmutableEmbedFieldDraft;
import io.hookcron.client.api.ImmutableMessageSnapshot;
import io.hookcron.client.api.ImmutableStoredAttachment;
import io.hookcron.client.api.MessageSnapshot;
import io.hookcron.client.api.StoredAttachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the stored JSON form of {@link MessageSnapshot}.
 *
 * {@link #hydrate(String)} accepts anything. Values of an unexpected type fall back to
 * their defaults one by one and a warning is logged; unknown keys are ignored.
 */
public class SnapshotHydrator
{
    private static final Logger logger = LoggerFactory.getLogger(SnapshotHydrator.class);

    private final ObjectMapper mapper;

    @Inject
    public SnapshotHydrator(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    public String toJson(MessageSnapshot snapshot)
    {
        try {
            return mapper.writeValueAsString(snapshot);
        }
        catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize message snapshot", ex);
        }
    }

    public MessageSnapshot hydrate(String json)
    {
        if (json == null) {
            return MessageSnapshot.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        }
        catch (IOException ex) {
            logger.warn("Stored message snapshot is not valid JSON. Using an empty message: {}", ex.getMessage());
            return MessageSnapshot.empty();
        }
        return hydrate(root);
    }

    public MessageSnapshot hydrate(JsonNode root)
    {
        if (root == null || !root.isObject()) {
            logger.warn("Stored message snapshot is not an object. Using an empty message");
            return MessageSnapshot.empty();
        }

        ImmutableMessageSnapshot.Builder builder = MessageSnapshot.builder();
        builder.content(text(root, "content").or(""));
        builder.username(text(root, "username").or(""));
        builder.avatarUrl(text(root, "avatarUrl").or(""));
        builder.threadName(text(root, "threadName").or(""));
        builder.suppressEmbeds(bool(root, "suppressEmbeds"));
        builder.suppressNotifications(bool(root, "suppressNotifications"));
        builder.webhookUrl(text(root, "webhookUrl"));

        for (JsonNode embed : array(root, "embeds")) {
            if (embed.isObject()) {
                builder.addEmbeds(hydrateEmbed(embed));
            }
            else {
                logger.warn("Ignoring an embed that is not an object: {}", embed);
            }
        }

        for (JsonNode file : array(root, "files")) {
            Optional<StoredAttachment> attachment = hydrateAttachment(file);
            if (attachment.isPresent()) {
                builder.addFiles(attachment.get());
            }
        }

        return builder.build();
    }

    private EmbedDraft hydrateEmbed(JsonNode node)
    {
        ImmutableEmbedDraft.Builder builder = EmbedDraft.builder();
        builder.id(text(node, "id").or(""));
        builder.authorName(text(node, "authorName").or(""));
        builder.authorUrl(text(node, "authorUrl").or(""));
        builder.authorIconUrl(text(node, "authorIconUrl").or(""));
        builder.title(text(node, "title").or(""));
        builder.url(text(node, "url").or(""));
        builder.description(text(node, "description").or(""));
        builder.color(text(node, "color").or(EmbedDraft.DEFAULT_COLOR));
        builder.imageUrl(text(node, "imageUrl").or(""));
        builder.thumbnailUrl(text(node, "thumbnailUrl").or(""));
        builder.footerText(text(node, "footerText").or(""));
        builder.footerIconUrl(text(node, "footerIconUrl").or(""));
        builder.timestampValue(text(node, "timestampValue").or(""));
        for (JsonNode field : array(node, "fields")) {
            if (field.isObject()) {
                ImmutableEmbedFieldDraft.Builder fb = ImmutableEmbedFieldDraft.builder()
                    .id(text(field, "id").or(""))
                    .name(text(field, "name").or(""))
                    .value(text(field, "value").or(""))
                    .inline(bool(field, "inline"));
                builder.addFields(fb.build());
            }
            else {
                logger.warn("Ignoring an embed field that is not an object: {}", field);
            }
        }
        return builder.build();
    }

    private Optional<StoredAttachment> hydrateAttachment(JsonNode node)
    {
        Optional<String> name = text(node, "name");
        Optional<String> storagePath = text(node, "storagePath");
        if (!node.isObject() || !name.isPresent() || !storagePath.isPresent()) {
            logger.warn("Ignoring an attachment without name or storagePath: {}", node);
            return Optional.absent();
        }
        ImmutableStoredAttachment.Builder builder = StoredAttachment.builder()
            .name(name.get())
            .storagePath(storagePath.get())
            .size(number(node, "size").or(0L))
            .mimeType(text(node, "mimeType").or("application/octet-stream"));
        Optional<Long> index = number(node, "originalIndex");
        if (index.isPresent()) {
            builder.originalIndex(index.get().intValue());
        }
        return Optional.of(builder.build());
    }

    private static Optional<String> text(JsonNode node, String key)
    {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        if (!value.isTextual()) {
            logger.warn("Expected a string for '{}' but got {}. Using default", key, value.getNodeType());
            return Optional.absent();
        }
        return Optional.of(value.textValue());
    }

    private static boolean bool(JsonNode node, String key)
    {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            logger.warn("Expected a boolean for '{}' but got {}. Using false", key, value.getNodeType());
            return false;
        }
        return value.booleanValue();
    }

    private static Optional<Long> number(JsonNode node, String key)
    {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        if (!value.isIntegralNumber()) {
            logger.warn("Expected an integer for '{}' but got {}. Using default", key, value.getNodeType());
            return Optional.absent();
        }
        return Optional.of(value.longValue());
    }

    private static Iterable<JsonNode> array(JsonNode node, String key)
    {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return Collections.emptyList();
        }
        if (!value.isArray()) {
            logger.warn("Expected an array for '{}' but got {}. Using an empty list", key, value.getNodeType());
            return Collections.emptyList();
        }
        return value;
    }
}
