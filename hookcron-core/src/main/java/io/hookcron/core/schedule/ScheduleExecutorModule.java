package io.hookcron.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import io.hookcron.client.config.Config;

public class ScheduleExecutorModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(SchedulerManager.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleValidator.class).in(Scopes.SINGLETON);
        binder.bind(DeliveryRequestBuilder.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleManager.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleExecutor.class).in(Scopes.SINGLETON);
    }

    @Provides @Singleton
    ScheduleConfig provideScheduleConfig(Config systemConfig)
    {
        return ScheduleConfig.convertFrom(systemConfig);
    }

    @Provides @Singleton
    WebhookConfig provideWebhookConfig(Config systemConfig)
    {
        return WebhookConfig.convertFrom(systemConfig);
    }
}
