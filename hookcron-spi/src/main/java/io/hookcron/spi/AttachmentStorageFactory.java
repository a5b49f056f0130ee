package io.hookcron.spi;

import io.hookcron.client.config.Config;

public interface AttachmentStorageFactory
{
    String getType();

    // config contains keys under attachment.<type>. with the prefix removed
    AttachmentStorage newStorage(Config config);
}
