package io.perfectsched.core.schedule;

import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Proof of a claim on one occurrence of a schedule. Captured when the task is
 * acquired and used by heartbeat and finish.
 */
@Value.Immutable
public interface TaskToken
{
    String getRowId();

    // next_time of the row when it was claimed, in epoch seconds
    long getScheduledTime();

    Optional<String> getCron();

    int getDelay();

    String getTimezone();

    static ImmutableTaskToken.Builder builder()
    {
        return ImmutableTaskToken.builder();
    }
}
