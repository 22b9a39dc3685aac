package io.perfectsched.core.schedule;

import java.time.Instant;

import com.google.common.base.Optional;
import io.perfectsched.client.config.Config;
import org.immutables.value.Value;

@Value.Immutable
public interface ScheduleAttributes
{
    String getTimezone();

    int getDelay();

    Optional<String> getCron();

    /**
     * User payload without the {@code type} key.
     */
    Config getData();

    Instant getNextTime();

    Instant getNextRunTime();

    String getType();

    // not supported by this backend. always absent
    Optional<String> getMessage();

    // not supported by this backend. always absent
    Optional<String> getNode();

    static ImmutableScheduleAttributes.Builder builder()
    {
        return ImmutableScheduleAttributes.builder();
    }
}
