package io.perfectsched.core.schedule;

import org.immutables.value.Value;

@Value.Immutable
public abstract class Schedule
{
    public abstract String getKey();

    public static Schedule of(String key)
    {
        return ImmutableSchedule.builder()
            .key(key)
            .build();
    }
}
