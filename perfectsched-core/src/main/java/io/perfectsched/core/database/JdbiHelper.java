package io.perfectsched.core.database;

import javax.sql.DataSource;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.h2.H2DatabasePlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

public class JdbiHelper
{
    public static Jdbi createJdbi(DataSource ds)
    {
        Jdbi jdbi = Jdbi.create(ds);
        jdbi.installPlugin(new SqlObjectPlugin());
        if (ds.getClass().getCanonicalName().startsWith("org.h2")) {
            jdbi.installPlugin(new H2DatabasePlugin());
        }
        return jdbi;
    }
}
