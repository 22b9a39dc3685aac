package io.perfectsched.core.database;

import java.time.Instant;
import java.util.List;

import com.google.common.base.Optional;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.perfectsched.client.config.Config;
import io.perfectsched.client.config.ConfigException;
import io.perfectsched.core.schedule.AlreadyFinishedException;
import io.perfectsched.core.schedule.LeaseAcquirer;
import io.perfectsched.core.schedule.LeaseManager;
import io.perfectsched.core.schedule.ResourceConflictException;
import io.perfectsched.core.schedule.ResourceNotFoundException;
import io.perfectsched.core.schedule.Schedule;
import io.perfectsched.core.schedule.ScheduleBackend;
import io.perfectsched.core.schedule.ScheduleMetadata;
import io.perfectsched.core.schedule.ScheduleRepository;
import io.perfectsched.core.schedule.ScheduleUpdate;
import io.perfectsched.core.schedule.ScheduleWithMetadata;
import io.perfectsched.core.schedule.Task;
import io.perfectsched.core.schedule.TaskToken;
import io.perfectsched.commons.ThrowablesUtil;
import io.perfectsched.standards.StandardsModule;

public class RdbScheduleBackend
        implements ScheduleBackend
{
    /**
     * Builds a backend from {@code database.*} options. Connects to the database
     * and creates the schedule table unless {@code database.migrate} is false.
     *
     * @throws ConfigException if a required option is missing or invalid
     */
    public static RdbScheduleBackend open(Config systemConfig)
    {
        try {
            Injector injector = Guice.createInjector(
                    new DatabaseModule(systemConfig),
                    new StandardsModule());
            return injector.getInstance(RdbScheduleBackend.class);
        }
        catch (CreationException | ProvisionException ex) {
            Optional<ConfigException> configError = ThrowablesUtil.findCause(ex, ConfigException.class);
            if (configError.isPresent()) {
                throw configError.get();
            }
            throw ex;
        }
    }

    private final ScheduleRepository repository;
    private final LeaseAcquirer acquirer;
    private final LeaseManager leaseManager;
    private final DataSourceProvider dataSourceProvider;

    @Inject
    public RdbScheduleBackend(ScheduleRepository repository, LeaseAcquirer acquirer, LeaseManager leaseManager,
            DataSourceProvider dataSourceProvider)
    {
        this.repository = repository;
        this.acquirer = acquirer;
        this.leaseManager = leaseManager;
        this.dataSourceProvider = dataSourceProvider;
    }

    @Override
    public ScheduleMetadata getMetadata(String key)
        throws ResourceNotFoundException
    {
        return repository.getMetadata(key);
    }

    @Override
    public void list(ScheduleRepository.ScheduleAction action)
    {
        repository.list(action);
    }

    @Override
    public List<ScheduleWithMetadata> list()
    {
        return repository.list();
    }

    @Override
    public Schedule submit(String key, String type, Optional<String> cron, int delay, String timezone,
            Config data, Instant nextTime, Instant nextRunTime)
        throws ResourceConflictException
    {
        return repository.submit(key, type, cron, delay, timezone, data, nextTime, nextRunTime);
    }

    @Override
    public void delete(String key)
        throws ResourceNotFoundException
    {
        repository.delete(key);
    }

    @Override
    public void modify(String key, ScheduleUpdate update)
        throws ResourceNotFoundException
    {
        repository.modify(key, update);
    }

    @Override
    public List<Task> acquire(int aliveTime, int maxAcquire)
    {
        return acquirer.acquire(aliveTime, maxAcquire);
    }

    @Override
    public List<Task> acquire(int aliveTime, int maxAcquire, Instant now)
    {
        return acquirer.acquire(aliveTime, maxAcquire, now);
    }

    @Override
    public void heartbeat(TaskToken token, int aliveTime)
        throws AlreadyFinishedException
    {
        leaseManager.heartbeat(token, aliveTime);
    }

    @Override
    public void heartbeat(TaskToken token, int aliveTime, Instant now)
        throws AlreadyFinishedException
    {
        leaseManager.heartbeat(token, aliveTime, now);
    }

    @Override
    public void finish(TaskToken token)
        throws AlreadyFinishedException
    {
        leaseManager.finish(token);
    }

    @Override
    public void finish(TaskToken token, Instant now)
        throws AlreadyFinishedException
    {
        leaseManager.finish(token, now);
    }

    @Override
    public void close()
    {
        dataSourceProvider.close();
    }
}
