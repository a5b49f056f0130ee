package io.hookcron.core.payload;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class PayloadModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(PayloadSerializer.class).in(Scopes.SINGLETON);
        binder.bind(SnapshotHydrator.class).in(Scopes.SINGLETON);
        binder.bind(PayloadValidator.class).in(Scopes.SINGLETON);
    }
}
