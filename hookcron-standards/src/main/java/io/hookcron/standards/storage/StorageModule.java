package io.hookcron.standards.storage;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.hookcron.spi.AttachmentStorageFactory;

public class StorageModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        Multibinder.newSetBinder(binder, AttachmentStorageFactory.class)
            .addBinding().to(LocalAttachmentStorageFactory.class).in(Scopes.SINGLETON);
    }
}
