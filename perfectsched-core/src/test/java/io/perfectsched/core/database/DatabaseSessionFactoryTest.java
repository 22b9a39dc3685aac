package io.perfectsched.core.database;

import java.sql.SQLException;
import java.sql.SQLTransactionRollbackException;

import org.jdbi.v3.core.Jdbi;
import org.junit.Before;
import org.junit.Test;

import static io.perfectsched.core.database.DatabaseTestingUtils.createDatabaseConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;

public class DatabaseSessionFactoryTest
{
    private DatabaseSessionFactory factory;

    @Before
    public void setUp()
    {
        factory = new DatabaseSessionFactory(mock(Jdbi.class), DatabaseConfig.convertFrom(createDatabaseConfig()));
    }

    private static Exception wrap(SQLException cause)
    {
        return new RuntimeException("statement failed", cause);
    }

    @Test
    public void transactionRollbackIsTransient()
    {
        assertThat(factory.isTransientConflict(wrap(new SQLException("serialization failure", "40001"))), is(true));
        assertThat(factory.isTransientConflict(wrap(new SQLException("deadlock detected", "40P01"))), is(true));
        assertThat(factory.isTransientConflict(wrap(new SQLTransactionRollbackException("rollback"))), is(true));
        assertThat(factory.isTransientConflict(wrap(new SQLException("concurrent update", "90131"))), is(true));
    }

    @Test
    public void otherErrorsAreNotTransient()
    {
        assertThat(factory.isTransientConflict(wrap(new SQLException("duplicate key", "23505"))), is(false));
        assertThat(factory.isTransientConflict(wrap(new SQLException("no state"))), is(false));
        // message text is not inspected
        assertThat(factory.isTransientConflict(new RuntimeException("Deadlock found; try restarting transaction")), is(false));
    }
}
