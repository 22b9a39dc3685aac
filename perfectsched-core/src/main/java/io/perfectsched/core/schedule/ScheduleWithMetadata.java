package io.perfectsched.core.schedule;

import org.immutables.value.Value;

/**
 * A schedule enumerated by {@link ScheduleRepository#list(ScheduleRepository.ScheduleAction)}.
 */
@Value.Immutable
public abstract class ScheduleWithMetadata
        extends ScheduleMetadata
{
    public static ScheduleWithMetadata of(String key, ScheduleAttributes attributes)
    {
        return ImmutableScheduleWithMetadata.builder()
            .key(key)
            .attributes(attributes)
            .build();
    }
}
