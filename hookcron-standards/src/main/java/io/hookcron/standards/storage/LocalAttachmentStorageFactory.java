package io.hookcron.standards.storage;

import java.nio.file.Paths;
import io.hookcron.client.config.Config;
import io.hookcron.spi.AttachmentStorage;
import io.hookcron.spi.AttachmentStorageFactory;

public class LocalAttachmentStorageFactory
        implements AttachmentStorageFactory
{
    @Override
    public String getType()
    {
        return "local";
    }

    @Override
    public AttachmentStorage newStorage(Config config)
    {
        return new LocalAttachmentStorage(Paths.get(config.get("root", String.class, "attachments")));
    }
}
