package io.perfectsched.core.schedule;

import java.util.List;
import java.util.function.Consumer;

import com.google.common.base.Optional;

/**
 * Statements on the schedule table, bound to an open session.
 *
 * Conditional updates return true only if a row matched the condition.
 * Times are epoch seconds.
 */
public interface ScheduleTable
{
    Optional<ScheduleRow> findById(String id);

    // ordered by timeout
    void scan(Consumer<ScheduleRow> callback);

    // rows whose timeout <= now, ordered by timeout
    List<ScheduleRow> findDue(long now, int limit);

    void insert(ScheduleRow row)
        throws ResourceConflictException;

    boolean delete(String id);

    boolean updateSettings(String id, ScheduleUpdate update);

    // UPDATE SET timeout = newTimeout WHERE id = ? AND timeout = expectedTimeout
    boolean casTimeout(String id, long expectedTimeout, long newTimeout);

    // UPDATE SET timeout = newTimeout WHERE id = ? AND next_time = expectedNextTime
    boolean casLease(String id, long expectedNextTime, long newTimeout);

    // UPDATE SET timeout = newTimeout, next_time = newNextTime WHERE id = ? AND next_time = expectedNextTime
    boolean casOccurrence(String id, long expectedNextTime, long newTimeout, long newNextTime);
}
