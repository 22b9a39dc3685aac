package io.perfectsched.core.schedule;

import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * A row of the schedule table as it is stored. Times are epoch seconds.
 */
@Value.Immutable
public interface ScheduleRow
{
    String getId();

    // claim deadline. the schedule is due when this is <= now
    long getTimeout();

    long getNextTime();

    Optional<String> getCron();

    int getDelay();

    Optional<String> getData();

    Optional<String> getTimezone();

    static ImmutableScheduleRow.Builder builder()
    {
        return ImmutableScheduleRow.builder();
    }
}
