package io.perfectsched.core.schedule;

import java.time.Instant;

import org.immutables.value.Value;

/**
 * An occurrence of a schedule claimed by {@link LeaseAcquirer}.
 */
@Value.Immutable
public abstract class Task
        extends ScheduleMetadata
{
    public abstract Instant getScheduledTime();

    public abstract TaskToken getToken();

    public static Task of(String key, ScheduleAttributes attributes, Instant scheduledTime, TaskToken token)
    {
        return ImmutableTask.builder()
            .key(key)
            .attributes(attributes)
            .scheduledTime(scheduledTime)
            .token(token)
            .build();
    }
}
