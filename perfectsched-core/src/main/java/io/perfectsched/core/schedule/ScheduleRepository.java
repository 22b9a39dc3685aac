package io.perfectsched.core.schedule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.perfectsched.client.config.Config;
import io.perfectsched.client.config.ConfigException;
import io.perfectsched.core.session.SessionGuard;
import io.perfectsched.spi.CronEvaluator;

/**
 * Creates, reads, updates and deletes schedules.
 */
public class ScheduleRepository
{
    public interface ScheduleAction
    {
        void schedule(ScheduleWithMetadata schedule);
    }

    private final SessionGuard guard;
    private final ScheduleAttributeCodec codec;
    private final CronEvaluator cronEvaluator;

    @Inject
    public ScheduleRepository(SessionGuard guard, ScheduleAttributeCodec codec, CronEvaluator cronEvaluator)
    {
        this.guard = guard;
        this.codec = codec;
        this.cronEvaluator = cronEvaluator;
    }

    public ScheduleMetadata getMetadata(String key)
        throws ResourceNotFoundException
    {
        return guard.withSession((session) -> {
            Optional<ScheduleRow> row = session.getTable().findById(key);
            if (!row.isPresent()) {
                throw new ResourceNotFoundException("schedule key=" + key + " does not exist");
            }
            return ScheduleMetadata.of(key, codec.decode(row.get()));
        }, ResourceNotFoundException.class);
    }

    /**
     * Calls the action for each schedule in ascending order of the next run time.
     * The store is locked until all schedules are passed to the action.
     */
    public void list(ScheduleAction action)
    {
        guard.withSession((session) -> {
            session.getTable().scan((row) ->
                    action.schedule(ScheduleWithMetadata.of(row.getId(), codec.decode(row))));
            return null;
        });
    }

    public List<ScheduleWithMetadata> list()
    {
        ImmutableList.Builder<ScheduleWithMetadata> builder = ImmutableList.builder();
        list(builder::add);
        return builder.build();
    }

    public Schedule submit(String key, String type, Optional<String> cron, int delay, String timezone,
            Config data, Instant nextTime, Instant nextRunTime)
        throws ResourceConflictException
    {
        validateTimeZone(timezone);
        if (cron.isPresent()) {
            cronEvaluator.validate(cron.get());
        }
        ScheduleRow row = ScheduleRow.builder()
            .id(key)
            .timeout(nextRunTime.getEpochSecond())
            .nextTime(nextTime.getEpochSecond())
            .cron(cron)
            .delay(delay)
            .data(codec.encodeData(data, type))
            .timezone(timezone)
            .build();

        return guard.withSession((session) -> {
            session.getTable().insert(row);
            return Schedule.of(key);
        }, ResourceConflictException.class);
    }

    public void delete(String key)
        throws ResourceNotFoundException
    {
        guard.withSession((session) -> {
            if (!session.getTable().delete(key)) {
                throw new ResourceNotFoundException("schedule key=" + key + " does not exist");
            }
            return null;
        }, ResourceNotFoundException.class);
    }

    /**
     * Applies the present fields of the update. An empty update doesn't touch the store.
     */
    public void modify(String key, ScheduleUpdate update)
        throws ResourceNotFoundException
    {
        if (update.isEmpty()) {
            return;
        }
        if (update.getTimezone().isPresent()) {
            validateTimeZone(update.getTimezone().get());
        }
        if (update.getCron().isPresent()) {
            cronEvaluator.validate(update.getCron().get());
        }

        guard.withSession((session) -> {
            if (!session.getTable().updateSettings(key, update)) {
                throw new ResourceNotFoundException("schedule key=" + key + " does not exist");
            }
            return null;
        }, ResourceNotFoundException.class);
    }

    private static void validateTimeZone(String timezone)
    {
        try {
            ZoneId.of(timezone);
        }
        catch (DateTimeException ex) {
            throw new ConfigException("Invalid timezone: " + timezone, ex);
        }
    }
}
