package io.perfectsched.core.schedule;

import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Changes to the settings of a schedule. Absent fields are kept unchanged.
 * Type and payload of a schedule can't be changed.
 */
@Value.Immutable
public interface ScheduleUpdate
{
    Optional<String> getCron();

    Optional<Integer> getDelay();

    Optional<String> getTimezone();

    default boolean isEmpty()
    {
        return !getCron().isPresent() && !getDelay().isPresent() && !getTimezone().isPresent();
    }

    static ImmutableScheduleUpdate.Builder builder()
    {
        return ImmutableScheduleUpdate.builder();
    }
}
