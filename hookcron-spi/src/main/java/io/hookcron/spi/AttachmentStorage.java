package io.hookcron.spi;

import java.io.IOException;

public interface AttachmentStorage
{
    byte[] read(String storagePath)
        throws IOException;

    void delete(String storagePath)
        throws IOException;
}
