package io.perfectsched.core.database;

import java.sql.SQLException;
import java.sql.SQLTransactionRollbackException;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.perfectsched.commons.ThrowablesUtil;
import io.perfectsched.core.schedule.ScheduleTable;
import io.perfectsched.core.session.Session;
import io.perfectsched.core.session.SessionFactory;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

public class DatabaseSessionFactory
        implements SessionFactory
{
    private static final String H2_CONCURRENT_UPDATE = "90131";

    private final Jdbi dbi;
    private final String table;

    @Inject
    public DatabaseSessionFactory(Jdbi dbi, DatabaseConfig config)
    {
        this.dbi = dbi;
        this.table = config.getTable();
    }

    @Override
    public Session openSession()
    {
        // auto-commit. each statement is a transaction
        Handle handle = dbi.open();
        try {
            return new DatabaseSession(handle, new DatabaseScheduleTable(handle, table));
        }
        catch (RuntimeException ex) {
            handle.close();
            throw ex;
        }
    }

    /**
     * Class 40 of SQLSTATE is transaction rollback, which includes
     * serialization failure (40001) and deadlock detected (40P01).
     * H2 reports a concurrent update of the same row as 90131.
     */
    @Override
    public boolean isTransientConflict(Exception exception)
    {
        Optional<SQLException> sqlEx = ThrowablesUtil.findCause(exception, SQLException.class);
        if (!sqlEx.isPresent()) {
            return false;
        }
        if (sqlEx.get() instanceof SQLTransactionRollbackException) {
            return true;
        }
        String state = sqlEx.get().getSQLState();
        if (state == null) {
            return false;
        }
        return state.startsWith("40") || state.equals(H2_CONCURRENT_UPDATE);
    }

    private static class DatabaseSession
            implements Session
    {
        private final Handle handle;
        private final ScheduleTable table;

        DatabaseSession(Handle handle, ScheduleTable table)
        {
            this.handle = handle;
            this.table = table;
        }

        @Override
        public ScheduleTable getTable()
        {
            return table;
        }

        @Override
        public void close()
        {
            handle.close();
        }
    }
}
