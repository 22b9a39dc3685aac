package io.perfectsched.core.schedule;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.perfectsched.core.database.DatabaseConfig;
import io.perfectsched.core.session.SessionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Claims due schedules.
 *
 * Rows whose timeout is not later than now are scanned in batches, oldest
 * first. A row is claimed by moving its timeout to now + aliveTime on the
 * condition that the timeout is still the value that was read. If another
 * process changed the row in the meantime the update matches no rows and the
 * next row is tried.
 */
public class LeaseAcquirer
{
    private static final Logger logger = LoggerFactory.getLogger(LeaseAcquirer.class);

    public static final int DEFAULT_BATCH_SIZE = 4;

    private final SessionGuard guard;
    private final ScheduleAttributeCodec codec;
    private final Clock clock;
    private final int batchSize;

    @Inject
    public LeaseAcquirer(SessionGuard guard, ScheduleAttributeCodec codec, Clock clock, DatabaseConfig config)
    {
        this(guard, codec, clock, config.getAcquireBatchSize());
    }

    public LeaseAcquirer(SessionGuard guard, ScheduleAttributeCodec codec, Clock clock, int batchSize)
    {
        checkArgument(batchSize > 0, "batchSize must be positive");
        this.guard = guard;
        this.codec = codec;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    public List<Task> acquire(int aliveTime, int maxAcquire)
    {
        return acquire(aliveTime, maxAcquire, clock.instant());
    }

    /**
     * Claims at most one due schedule regardless of maxAcquire.
     *
     * @return a list with the claimed task, or an empty list if nothing is due
     */
    public List<Task> acquire(int aliveTime, int maxAcquire, Instant now)
    {
        checkArgument(maxAcquire >= 1, "maxAcquire must be >= 1");
        long currentTime = now.getEpochSecond();
        long nextTimeout = currentTime + aliveTime;

        return guard.withSession((session) -> {
            ScheduleTable table = session.getTable();
            while (true) {
                List<ScheduleRow> rows = table.findDue(currentTime, batchSize);
                for (ScheduleRow row : rows) {
                    if (table.casTimeout(row.getId(), row.getTimeout(), nextTimeout)) {
                        logger.debug("Claimed schedule {} at {} until {}", row.getId(), row.getNextTime(), nextTimeout);
                        return ImmutableList.of(toTask(row));
                    }
                    logger.debug("Schedule {} was claimed by another process", row.getId());
                }
                if (rows.size() < batchSize) {
                    return ImmutableList.of();
                }
            }
        });
    }

    private Task toTask(ScheduleRow row)
    {
        return Task.of(row.getId(),
                codec.decode(row),
                Instant.ofEpochSecond(row.getNextTime()),
                codec.toToken(row));
    }
}
