package io.hookcron.standards;

import com.google.inject.Binder;
import com.google.inject.Module;
import io.hookcron.standards.delivery.DeliveryModule;
import io.hookcron.standards.scheduler.SchedulerModule;
import io.hookcron.standards.storage.StorageModule;

public class StandardsModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.install(new SchedulerModule());
        binder.install(new DeliveryModule());
        binder.install(new StorageModule());
    }
}
