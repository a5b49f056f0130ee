package io.hookcron.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.Stage;
import com.google.inject.util.Modules;
import io.hookcron.client.ObjectMappers;
import io.hookcron.client.config.Config;
import io.hookcron.client.config.ConfigElement;
import io.hookcron.client.config.ConfigFactory;
import io.hookcron.core.database.DataSourceProvider;
import io.hookcron.core.database.DatabaseConfig;
import io.hookcron.core.database.DatabaseMigrator;
import io.hookcron.core.database.DatabaseModule;
import io.hookcron.core.database.TransactionManager;
import io.hookcron.core.payload.PayloadModule;
import io.hookcron.core.schedule.ScheduleExecutor;
import io.hookcron.core.schedule.ScheduleExecutorModule;
import io.hookcron.core.schedule.ScheduleManager;
import io.hookcron.core.storage.AttachmentStorageManager;

/**
 * Wires the engine together. Scheduler, delivery and storage implementations are not part of
 * this module and are added with {@link Bootstrap#addModules}.
 */
public class HookcronEmbed
        implements AutoCloseable
{
    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private ConfigElement systemConfig = ConfigElement.empty();

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            return overrideModulesWith(Arrays.asList(overridingModules));
        }

        public Bootstrap overrideModulesWith(Iterable<? extends Module> overridingModules)
        {
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(overridingModules)));
        }

        public Bootstrap setSystemConfig(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        /**
         * Creates the injector and migrates the database if {@code database.migrate} is enabled.
         * The schedule poller is not started.
         */
        public HookcronEmbed initialize()
        {
            List<Module> modules = standardModules(systemConfig);
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            Injector injector = Guice.createInjector(Stage.PRODUCTION, modules);
            HookcronEmbed embed = new HookcronEmbed(injector);
            embed.autoMigrate();
            return embed;
        }

        private static List<Module> standardModules(ConfigElement systemConfig)
        {
            return ImmutableList.of(
                    new DatabaseModule(),
                    new PayloadModule(),
                    new ScheduleExecutorModule(),
                    (binder) -> {
                        binder.requireExplicitBindings();
                        binder.bind(ObjectMapper.class).toInstance(ObjectMappers.objectMapper());
                        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
                        binder.bind(ConfigElement.class).toInstance(systemConfig);
                        binder.bind(Config.class).toProvider(SystemConfigProvider.class).in(Scopes.SINGLETON);
                        binder.bind(AttachmentStorageManager.class).in(Scopes.SINGLETON);
                    });
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(ConfigElement ce, ConfigFactory cf)
        {
            this.systemConfig = ce.toConfig(cf);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }

    private final Injector injector;

    HookcronEmbed(Injector injector)
    {
        this.injector = injector;
    }

    private void autoMigrate()
    {
        if (injector.getInstance(DatabaseConfig.class).getAutoMigrate()) {
            injector.getInstance(DatabaseMigrator.class).migrate();
        }
    }

    public Injector getInjector()
    {
        return injector;
    }

    public TransactionManager getTransactionManager()
    {
        return injector.getInstance(TransactionManager.class);
    }

    public ScheduleManager getScheduleManager()
    {
        return injector.getInstance(ScheduleManager.class);
    }

    public ScheduleExecutor getScheduleExecutor()
    {
        return injector.getInstance(ScheduleExecutor.class);
    }

    @Override
    public void close()
    {
        try {
            injector.getInstance(ScheduleExecutor.class).shutdown();
        }
        finally {
            injector.getInstance(DataSourceProvider.class).close();
        }
    }
}
