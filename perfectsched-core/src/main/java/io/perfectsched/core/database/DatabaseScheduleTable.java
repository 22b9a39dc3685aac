package io.perfectsched.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import com.google.common.base.Optional;
import io.perfectsched.core.schedule.ResourceConflictException;
import io.perfectsched.core.schedule.ScheduleRow;
import io.perfectsched.core.schedule.ScheduleTable;
import io.perfectsched.core.schedule.ScheduleUpdate;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.result.ResultIterable;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.jdbi.v3.core.statement.Update;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Statements on the schedule table. The table name is given by configuration
 * and is substituted into {@code <table>} of each statement.
 */
public class DatabaseScheduleTable
        implements ScheduleTable
{
    private final Handle handle;
    private final String table;
    private final Dao dao;

    public DatabaseScheduleTable(Handle handle, String table)
    {
        this.handle = handle;
        this.table = table;
        handle.registerRowMapper(new ScheduleRowMapper());
        handle.define("table", table);
        this.dao = handle.attach(Dao.class);
    }

    @Override
    public Optional<ScheduleRow> findById(String id)
    {
        return Optional.fromNullable(dao.findById(id));
    }

    @Override
    public void scan(Consumer<ScheduleRow> callback)
    {
        dao.scan().forEach(callback);
    }

    @Override
    public List<ScheduleRow> findDue(long now, int limit)
    {
        return dao.findDue(now, limit);
    }

    @Override
    public void insert(ScheduleRow row)
        throws ResourceConflictException
    {
        try {
            dao.insert(row.getId(), row.getTimeout(), row.getNextTime(),
                    row.getCron().orNull(), row.getDelay(), row.getData().orNull(), row.getTimezone().orNull());
        }
        catch (UnableToExecuteStatementException ex) {
            if (ex.getCause() instanceof SQLException) {
                SQLException sqlEx = (SQLException) ex.getCause();
                if (isConflictException(sqlEx)) {
                    throw new ResourceConflictException("schedule key=" + row.getId() + " already exists", ex);
                }
            }
            throw ex;
        }
    }

    @Override
    public boolean delete(String id)
    {
        return dao.delete(id) > 0;
    }

    @Override
    public boolean updateSettings(String id, ScheduleUpdate update)
    {
        List<String> sets = new ArrayList<>();
        if (update.getCron().isPresent()) {
            sets.add("cron = :cron");
        }
        if (update.getDelay().isPresent()) {
            sets.add("delay = :delay");
        }
        if (update.getTimezone().isPresent()) {
            sets.add("timezone = :timezone");
        }
        if (sets.isEmpty()) {
            throw new IllegalArgumentException("update has no fields");
        }

        Update stmt = handle.createUpdate(
                "update " + table + " set " + String.join(", ", sets) + " where id = :id")
            .bind("id", id);
        if (update.getCron().isPresent()) {
            stmt.bind("cron", update.getCron().get());
        }
        if (update.getDelay().isPresent()) {
            stmt.bind("delay", update.getDelay().get());
        }
        if (update.getTimezone().isPresent()) {
            stmt.bind("timezone", update.getTimezone().get());
        }
        return stmt.execute() > 0;
    }

    @Override
    public boolean casTimeout(String id, long expectedTimeout, long newTimeout)
    {
        return dao.casTimeout(id, expectedTimeout, newTimeout) > 0;
    }

    @Override
    public boolean casLease(String id, long expectedNextTime, long newTimeout)
    {
        return dao.casLease(id, expectedNextTime, newTimeout) > 0;
    }

    @Override
    public boolean casOccurrence(String id, long expectedNextTime, long newTimeout, long newNextTime)
    {
        return dao.casOccurrence(id, expectedNextTime, newTimeout, newNextTime) > 0;
    }

    static boolean isConflictException(SQLException ex)
    {
        // h2 and postgresql
        return "23505".equals(ex.getSQLState());
    }

    interface Dao
    {
        @SqlQuery("select id, timeout, next_time, cron, delay, data, timezone from <table>" +
                " where id = :id")
        ScheduleRow findById(@Bind("id") String id);

        @SqlQuery("select id, timeout, next_time, cron, delay, data, timezone from <table>" +
                " order by timeout asc")
        ResultIterable<ScheduleRow> scan();

        @SqlQuery("select id, timeout, next_time, cron, delay, data, timezone from <table>" +
                " where timeout \\<= :now" +
                " order by timeout asc" +
                " limit :limit")
        List<ScheduleRow> findDue(@Bind("now") long now, @Bind("limit") int limit);

        @SqlUpdate("insert into <table> (id, timeout, next_time, cron, delay, data, timezone)" +
                " values (:id, :timeout, :nextTime, :cron, :delay, :data, :timezone)")
        int insert(@Bind("id") String id, @Bind("timeout") long timeout, @Bind("nextTime") long nextTime,
                @Bind("cron") String cron, @Bind("delay") int delay, @Bind("data") String data, @Bind("timezone") String timezone);

        @SqlUpdate("delete from <table> where id = :id")
        int delete(@Bind("id") String id);

        @SqlUpdate("update <table> set timeout = :newTimeout" +
                " where id = :id and timeout = :expectedTimeout")
        int casTimeout(@Bind("id") String id, @Bind("expectedTimeout") long expectedTimeout, @Bind("newTimeout") long newTimeout);

        @SqlUpdate("update <table> set timeout = :newTimeout" +
                " where id = :id and next_time = :expectedNextTime")
        int casLease(@Bind("id") String id, @Bind("expectedNextTime") long expectedNextTime, @Bind("newTimeout") long newTimeout);

        @SqlUpdate("update <table> set timeout = :newTimeout, next_time = :newNextTime" +
                " where id = :id and next_time = :expectedNextTime")
        int casOccurrence(@Bind("id") String id, @Bind("expectedNextTime") long expectedNextTime,
                @Bind("newTimeout") long newTimeout, @Bind("newNextTime") long newNextTime);
    }

    static class ScheduleRowMapper
            implements RowMapper<ScheduleRow>
    {
        @Override
        public ScheduleRow map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ScheduleRow.builder()
                .id(r.getString("id"))
                .timeout(r.getLong("timeout"))
                .nextTime(r.getLong("next_time"))
                .cron(Optional.fromNullable(r.getString("cron")))
                .delay(r.getInt("delay"))
                .data(Optional.fromNullable(r.getString("data")))
                .timezone(Optional.fromNullable(r.getString("timezone")))
                .build();
        }
    }
}
