package io.perfectsched.core.schedule;

import org.immutables.value.Value;

@Value.Immutable
public abstract class ScheduleMetadata
        extends Schedule
{
    public abstract ScheduleAttributes getAttributes();

    public static ScheduleMetadata of(String key, ScheduleAttributes attributes)
    {
        return ImmutableScheduleMetadata.builder()
            .key(key)
            .attributes(attributes)
            .build();
    }
}
