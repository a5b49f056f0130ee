package io.hookcron.core.payload;

import com.google.inject.Inject;
import io.hookcron.client.api.EmbedDraft;
import io.hookcron.client.api.MessageSnapshot;
import io.hookcron.client.api.StoredAttachment;
import io.hookcron.client.api.WebhookMessage;
import io.hookcron.client.config.ConfigException;

import static io.hookcron.core.payload.PayloadLimits.MAX_CONTENT_LENGTH;
import static io.hookcron.core.payload.PayloadLimits.MAX_DESCRIPTION_LENGTH;
import static io.hookcron.core.payload.PayloadLimits.MAX_EMBEDS;
import static io.hookcron.core.payload.PayloadLimits.MAX_TOTAL_ATTACHMENT_SIZE;

public class PayloadValidator
{
    private final PayloadSerializer serializer;

    @Inject
    public PayloadValidator(PayloadSerializer serializer)
    {
        this.serializer = serializer;
    }

    public void validate(MessageSnapshot snapshot)
    {
        int contentLength = snapshot.getContent().trim().length();
        if (contentLength > MAX_CONTENT_LENGTH) {
            throw new ConfigException(String.format(
                        "Message content must be at most %d characters but got %d",
                        MAX_CONTENT_LENGTH, contentLength));
        }

        if (snapshot.getEmbeds().size() > MAX_EMBEDS) {
            throw new ConfigException(String.format(
                        "A message can have at most %d embeds but got %d",
                        MAX_EMBEDS, snapshot.getEmbeds().size()));
        }

        int index = 0;
        for (EmbedDraft embed : snapshot.getEmbeds()) {
            int descriptionLength = embed.getDescription().trim().length();
            if (descriptionLength > MAX_DESCRIPTION_LENGTH) {
                throw new ConfigException(String.format(
                            "Description of embed %d must be at most %d characters but got %d",
                            index + 1, MAX_DESCRIPTION_LENGTH, descriptionLength));
            }
            index++;
        }

        long totalSize = 0;
        for (StoredAttachment file : snapshot.getFiles()) {
            if (file.getSize() < 0) {
                throw new ConfigException(String.format(
                            "Size of attachment '%s' must not be negative but got %d",
                            file.getName(), file.getSize()));
            }
            totalSize += file.getSize();
        }
        if (totalSize > MAX_TOTAL_ATTACHMENT_SIZE) {
            throw new ConfigException(String.format(
                        "Total attachment size must be at most %d bytes but got %d",
                        MAX_TOTAL_ATTACHMENT_SIZE, totalSize));
        }

        WebhookMessage message = serializer.buildPayload(snapshot);
        if (PayloadSerializer.isEmptyMessage(message) && snapshot.getFiles().isEmpty()) {
            throw new ConfigException("Message must have content, an embed or an attachment");
        }
    }
}
