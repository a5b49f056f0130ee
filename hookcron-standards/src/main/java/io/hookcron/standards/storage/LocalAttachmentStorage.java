package io.hookcron.standards.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import io.hookcron.spi.AttachmentStorage;

/**
 * Reads attachments uploaded to a directory on the local file system.
 * Storage paths are relative to the root directory.
 */
public class LocalAttachmentStorage
        implements AttachmentStorage
{
    private final Path root;

    public LocalAttachmentStorage(Path root)
    {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public byte[] read(String storagePath)
        throws IOException
    {
        return Files.readAllBytes(resolve(storagePath));
    }

    @Override
    public void delete(String storagePath)
        throws IOException
    {
        Files.deleteIfExists(resolve(storagePath));
    }

    private Path resolve(String storagePath)
        throws IOException
    {
        String relative = storagePath.startsWith("/") ? storagePath.substring(1) : storagePath;
        Path path = root.resolve(relative).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IOException("Storage path is outside of the attachment root: " + storagePath);
        }
        return path;
    }
}
