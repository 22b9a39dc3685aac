package io.perfectsched.spi;

import com.google.common.base.Optional;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Computes occurrences of a recurring schedule.
 *
 * Implementations must be pure functions. They are called when a claimed
 * occurrence is finished to decide the next occurrence of the schedule.
 */
public interface CronEvaluator
{
    /**
     * Occurrence time returned for a schedule that has no more occurrences.
     * 9999-01-01 00:00:00 +0000
     */
    Instant SCHEDULE_END = Instant.ofEpochSecond(253370764800L);

    // getTime of returned value is after afterTime, truncated to seconds.
    // absent cron means a one-shot schedule; implementations decide what comes next.
    Instant nextOccurrence(Optional<String> cron, Instant afterTime, ZoneId timeZone);

    // throws an unchecked exception if the expression can't be evaluated by nextOccurrence.
    void validate(String cron);
}
