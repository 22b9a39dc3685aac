package io.perfectsched.core.schedule;

import java.time.Instant;
import java.util.List;

import com.google.common.base.Optional;
import io.perfectsched.client.config.Config;

/**
 * Storage of schedules shared by worker processes.
 *
 * Workers claim due schedules with {@link #acquire(int, int, Instant)}, extend
 * the claim with {@link #heartbeat(TaskToken, int, Instant)} while processing,
 * and move the schedule to its next occurrence with {@link #finish(TaskToken)}.
 * Times are handled in whole seconds.
 */
public interface ScheduleBackend
        extends AutoCloseable
{
    ScheduleMetadata getMetadata(String key)
        throws ResourceNotFoundException;

    void list(ScheduleRepository.ScheduleAction action);

    List<ScheduleWithMetadata> list();

    Schedule submit(String key, String type, Optional<String> cron, int delay, String timezone,
            Config data, Instant nextTime, Instant nextRunTime)
        throws ResourceConflictException;

    void delete(String key)
        throws ResourceNotFoundException;

    void modify(String key, ScheduleUpdate update)
        throws ResourceNotFoundException;

    List<Task> acquire(int aliveTime, int maxAcquire);

    List<Task> acquire(int aliveTime, int maxAcquire, Instant now);

    void heartbeat(TaskToken token, int aliveTime)
        throws AlreadyFinishedException;

    void heartbeat(TaskToken token, int aliveTime, Instant now)
        throws AlreadyFinishedException;

    void finish(TaskToken token)
        throws AlreadyFinishedException;

    void finish(TaskToken token, Instant now)
        throws AlreadyFinishedException;

    @Override
    void close();
}
