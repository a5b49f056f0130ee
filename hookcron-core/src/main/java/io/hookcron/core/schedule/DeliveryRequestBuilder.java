package io.hookcron.core.schedule;

import java.io.IOException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import io.hookcron.client.api.MessageSnapshot;
import io.hookcron.client.api.StoredAttachment;
import io.hookcron.client.api.WebhookMessage;
import io.hookcron.core.payload.PayloadSerializer;
import io.hookcron.core.payload.SnapshotHydrator;
import io.hookcron.core.storage.AttachmentStorageManager;
import io.hookcron.spi.AttachmentStorage;
import io.hookcron.spi.DeliveryAttachment;
import io.hookcron.spi.DeliveryRequest;
import io.hookcron.spi.ImmutableDeliveryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes the message of a due schedule. Rows with a stored snapshot are serialized from it;
 * rows that only carry pre-built {@code message_data} are sent as is.
 */
public class DeliveryRequestBuilder
{
    private static final Logger logger = LoggerFactory.getLogger(DeliveryRequestBuilder.class);

    private final SnapshotHydrator hydrator;
    private final PayloadSerializer serializer;
    private final AttachmentStorageManager storageManager;
    private final ObjectMapper mapper;

    @Inject
    public DeliveryRequestBuilder(
            SnapshotHydrator hydrator,
            PayloadSerializer serializer,
            AttachmentStorageManager storageManager,
            ObjectMapper mapper)
    {
        this.hydrator = hydrator;
        this.serializer = serializer;
        this.storageManager = storageManager;
        this.mapper = mapper;
    }

    public DeliveryRequest build(StoredSchedule schedule)
        throws PayloadUnavailableException
    {
        ImmutableDeliveryRequest.Builder builder = DeliveryRequest.builder()
            .url(schedule.getTargetUrl());

        if (schedule.getPayload().isPresent()) {
            MessageSnapshot snapshot = hydrator.hydrate(schedule.getPayload().get());
            WebhookMessage message = serializer.buildPayload(snapshot);
            if (PayloadSerializer.isEmptyMessage(message) && snapshot.getFiles().isEmpty()) {
                throw new PayloadUnavailableException("Message has no content, embed or attachment");
            }
            builder.payloadJson(serializer.toJson(message));
            for (StoredAttachment file : snapshot.getFiles()) {
                builder.addAttachments(readAttachment(file));
            }
        }
        else if (schedule.getMessageData().isPresent()) {
            builder.payloadJson(legacyMessageData(schedule));
        }
        else {
            throw new PayloadUnavailableException("Schedule has no message");
        }

        return builder.build();
    }

    private String legacyMessageData(StoredSchedule schedule)
        throws PayloadUnavailableException
    {
        String data = schedule.getMessageData().get();
        JsonNode node;
        try {
            node = mapper.readTree(data);
        }
        catch (IOException ex) {
            throw new PayloadUnavailableException("Stored message_data is not valid JSON", ex);
        }
        if (node == null || !node.isObject()) {
            throw new PayloadUnavailableException("Stored message_data must be a JSON object");
        }
        logger.debug("Sending stored message_data of schedule {} as is", schedule.getId());
        return data;
    }

    private DeliveryAttachment readAttachment(StoredAttachment file)
        throws PayloadUnavailableException
    {
        AttachmentStorage storage = storageManager.getStorage();
        byte[] content;
        try {
            content = storage.read(file.getStoragePath());
        }
        catch (IOException ex) {
            throw new PayloadUnavailableException("Failed to read attachment " + file.getName() + ": " + ex.getMessage(), ex);
        }
        return DeliveryAttachment.of(file.getName(), file.getMimeType(), content);
    }
}
