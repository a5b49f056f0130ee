package io.hookcron.standards.scheduler;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.hookcron.spi.SchedulerFactory;

public class SchedulerModule
    implements Module
{
    @Override
    public void configure(Binder binder)
    {
        addStandardSchedulerFactory(binder, OnceSchedulerFactory.class);
        addStandardSchedulerFactory(binder, CronSchedulerFactory.class);
    }

    protected void addStandardSchedulerFactory(Binder binder, Class<? extends SchedulerFactory> factory)
    {
        Multibinder.newSetBinder(binder, SchedulerFactory.class)
            .addBinding().to(factory).in(Scopes.SINGLETON);
    }
}
