package io.perfectsched.core.database;

import java.time.Clock;
import javax.sql.DataSource;

import com.google.inject.Binder;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import io.perfectsched.client.config.Config;
import io.perfectsched.client.config.ConfigFactory;
import io.perfectsched.core.schedule.LeaseAcquirer;
import io.perfectsched.core.schedule.LeaseManager;
import io.perfectsched.core.schedule.ScheduleAttributeCodec;
import io.perfectsched.core.schedule.ScheduleBackend;
import io.perfectsched.core.schedule.ScheduleRepository;
import io.perfectsched.core.session.SessionFactory;
import io.perfectsched.core.session.SessionGuard;
import org.jdbi.v3.core.Jdbi;

public class DatabaseModule
        implements Module
{
    private final Config systemConfig;

    public DatabaseModule(Config systemConfig)
    {
        this.systemConfig = systemConfig;
    }

    @Override
    public void configure(Binder binder)
    {
        binder.bind(Config.class).toInstance(systemConfig);
        binder.bind(ConfigFactory.class).toInstance(systemConfig.getFactory());
        binder.bind(Clock.class).toInstance(Clock.systemUTC());
        binder.bind(DatabaseConfig.class).toProvider(DatabaseConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(Jdbi.class).toProvider(JdbiProvider.class).in(Scopes.SINGLETON);
        binder.bind(SessionFactory.class).to(DatabaseSessionFactory.class).in(Scopes.SINGLETON);
        binder.bind(SessionGuard.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleAttributeCodec.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleRepository.class).in(Scopes.SINGLETON);
        binder.bind(LeaseAcquirer.class).in(Scopes.SINGLETON);
        binder.bind(LeaseManager.class).in(Scopes.SINGLETON);
        binder.bind(RdbScheduleBackend.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleBackend.class).to(RdbScheduleBackend.class);
    }

    public static class JdbiProvider
            implements Provider<Jdbi>
    {
        private final DataSource ds;
        private final DatabaseConfig config;

        @Inject
        public JdbiProvider(DataSource ds, DatabaseConfig config)
        {
            this.ds = ds;
            this.config = config;
        }

        @Override
        public Jdbi get()
        {
            Jdbi dbi = JdbiHelper.createJdbi(ds);
            if (config.getAutoMigrate()) {
                new DatabaseMigrator(dbi, config).migrate();
            }
            return dbi;
        }
    }
}
