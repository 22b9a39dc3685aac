package io.perfectsched.core.session;

import io.perfectsched.core.schedule.ScheduleTable;

/**
 * An open connection to the schedule store. A session is used by exactly one
 * action attempt and closed afterwards.
 */
public interface Session
        extends AutoCloseable
{
    ScheduleTable getTable();

    @Override
    void close();
}
