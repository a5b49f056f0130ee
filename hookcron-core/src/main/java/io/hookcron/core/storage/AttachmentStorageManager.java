package io.hookcron.core.storage;

import java.util.Map;
import java.util.Set;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigException;
import io.hookcron.spi.AttachmentStorage;
import io.hookcron.spi.AttachmentStorageFactory;

/**
 * Creates the {@link AttachmentStorage} configured by {@code attachment.type}. Keys under
 * {@code attachment.<type>.} are passed to the factory with the prefix removed.
 */
public class AttachmentStorageManager
{
    public static final String CONFIG_KEY_PREFIX = "attachment.";
    public static final String DEFAULT_TYPE = "local";

    private final Map<String, AttachmentStorageFactory> registry;
    private final Config systemConfig;
    private AttachmentStorage storage;

    @Inject
    public AttachmentStorageManager(Set<AttachmentStorageFactory> factories, Config systemConfig)
    {
        ImmutableMap.Builder<String, AttachmentStorageFactory> builder = ImmutableMap.builder();
        for (AttachmentStorageFactory factory : factories) {
            builder.put(factory.getType(), factory);
        }
        this.registry = builder.build();
        this.systemConfig = systemConfig;
    }

    public synchronized AttachmentStorage getStorage()
    {
        if (storage == null) {
            String type = systemConfig.get(CONFIG_KEY_PREFIX + "type", String.class, DEFAULT_TYPE);
            storage = create(type);
        }
        return storage;
    }

    private AttachmentStorage create(String type)
    {
        AttachmentStorageFactory factory = registry.get(type);
        if (factory == null) {
            throw new ConfigException("Unknown attachment storage type: " + type);
        }
        return factory.newStorage(systemConfig.extractPrefixed(CONFIG_KEY_PREFIX + type + "."));
    }
}
