package io.perfectsched.core.schedule;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import com.google.inject.Inject;
import io.perfectsched.core.session.SessionGuard;
import io.perfectsched.spi.CronEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extends and completes leases claimed by {@link LeaseAcquirer}.
 *
 * Both operations update the row only if its next_time still equals the
 * scheduled time of the token. Otherwise the occurrence was already finished
 * and {@link AlreadyFinishedException} is thrown.
 */
public class LeaseManager
{
    private static final Logger logger = LoggerFactory.getLogger(LeaseManager.class);

    private final SessionGuard guard;
    private final CronEvaluator cron;
    private final Clock clock;

    @Inject
    public LeaseManager(SessionGuard guard, CronEvaluator cron, Clock clock)
    {
        this.guard = guard;
        this.cron = cron;
        this.clock = clock;
    }

    public void heartbeat(TaskToken token, int aliveTime)
        throws AlreadyFinishedException
    {
        heartbeat(token, aliveTime, clock.instant());
    }

    public void heartbeat(TaskToken token, int aliveTime, Instant now)
        throws AlreadyFinishedException
    {
        long nextTimeout = now.getEpochSecond() + aliveTime;

        guard.withSession((session) -> {
            if (!session.getTable().casLease(token.getRowId(), token.getScheduledTime(), nextTimeout)) {
                throw alreadyFinished(token);
            }
            return null;
        }, AlreadyFinishedException.class);
    }

    public void finish(TaskToken token)
        throws AlreadyFinishedException
    {
        finish(token, clock.instant());
    }

    /**
     * The next occurrence depends only on the token. {@code now} is used for logging.
     */
    public void finish(TaskToken token, Instant now)
        throws AlreadyFinishedException
    {
        Instant scheduledTime = Instant.ofEpochSecond(token.getScheduledTime());
        Instant nextTime = cron.nextOccurrence(token.getCron(), scheduledTime, ZoneId.of(token.getTimezone()));
        long nextRunTime = nextTime.getEpochSecond() + token.getDelay();

        guard.withSession((session) -> {
            if (!session.getTable().casOccurrence(token.getRowId(), token.getScheduledTime(), nextRunTime, nextTime.getEpochSecond())) {
                throw alreadyFinished(token);
            }
            logger.debug("Finished schedule {} at {} ({}s after scheduled time {}). Next time is {}",
                    token.getRowId(), now, now.getEpochSecond() - token.getScheduledTime(), scheduledTime, nextTime);
            return null;
        }, AlreadyFinishedException.class);
    }

    private static AlreadyFinishedException alreadyFinished(TaskToken token)
    {
        logger.debug("Lease of schedule {} at {} is lost", token.getRowId(), token.getScheduledTime());
        return new AlreadyFinishedException("task time=" + Instant.ofEpochSecond(token.getScheduledTime()) + " is already finished");
    }
}
