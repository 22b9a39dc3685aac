package io.perfectsched.core.database;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import io.perfectsched.core.database.migrate.Migration;
import io.perfectsched.core.database.migrate.MigrationContext;
import io.perfectsched.core.database.migrate.Migration_20240311093000_CreateSchedules;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the schedule table. Applied migrations are recorded in
 * {@code <table>_schema_migrations} so that each migration runs once.
 */
public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final List<Migration> migrations = Stream.of(new Migration[] {
        new Migration_20240311093000_CreateSchedules(),
    })
    .sorted(Comparator.comparing(m -> m.getVersion()))
    .collect(Collectors.toList());

    private final Jdbi dbi;
    private final MigrationContext context;

    @Inject
    public DatabaseMigrator(Jdbi dbi, DatabaseConfig config)
    {
        this.dbi = dbi;
        this.context = new MigrationContext(config.getType(), config.getTable());
    }

    public static String getDriverClassName(String type)
    {
        switch (type) {
        case "h2":
            return "org.h2.Driver";
        case "postgresql":
            return "org.postgresql.Driver";
        default:
            throw new RuntimeException("Unsupported database type: "+type);
        }
    }

    public int migrate()
    {
        int numApplied = 0;
        Set<String> appliedSet;
        try (Handle handle = dbi.open()) {
            createSchemaMigrationsTable(handle);
            appliedSet = getAppliedMigrationNames(handle);
        }
        for (Migration m : migrations) {
            if (appliedSet.add(m.getVersion())) {
                if (applyMigrationIfNotDone(m)) {
                    numApplied++;
                }
            }
        }
        if (numApplied > 0) {
            logger.info("{} migrations applied to {}.", numApplied, context.getTableName());
        }
        return numApplied;
    }

    // add "synchronized" so that multiple threads don't run the same migration on the same database
    private synchronized boolean applyMigrationIfNotDone(Migration m)
    {
        try (Handle handle = dbi.open()) {
            // Start transaction -> Lock table -> Re-check migration status -> migrate
            return handle.inTransaction((h) -> {
                if (context.isPostgres()) {
                    // lock tables not to run migration concurrently.
                    h.execute("LOCK TABLE " + context.getSchemaMigrationsTableName() + " IN EXCLUSIVE MODE");
                }
                // re-check migration status after lock
                if (checkIfMigrationApplied(h, m.getVersion())) {
                    return false;
                }
                logger.info("Applying database migration {} to {}", m.getVersion(), context.getTableName());
                applyMigration(m, h);
                return true;
            });
        }
    }

    public Set<String> getAppliedMigrationNames()
    {
        try (Handle handle = dbi.open()) {
            return getAppliedMigrationNames(handle);
        }
    }

    private Set<String> getAppliedMigrationNames(Handle handle)
    {
        return new HashSet<>(
                handle.createQuery("select name from " + context.getSchemaMigrationsTableName())
                .mapTo(String.class)
                .list());
    }

    private boolean checkIfMigrationApplied(Handle handle, String name)
    {
        return handle.createQuery("select name from " + context.getSchemaMigrationsTableName() + " where name = :name")
            .bind("name", name)
            .mapTo(String.class)
            .list()
            .size() > 0;
    }

    private void createSchemaMigrationsTable(Handle handle)
    {
        handle.execute(
                context.newCreateTableBuilder(context.getSchemaMigrationsTableName())
                .ifNotExists()
                .addString("name", "not null")
                .addTimestamp("created_at", "not null")
                .build());
    }

    @VisibleForTesting
    void applyMigration(Migration m, Handle handle)
    {
        m.migrate(handle, context);
        handle.execute("insert into " + context.getSchemaMigrationsTableName() + " (name, created_at) values (?, CURRENT_TIMESTAMP)", m.getVersion());
    }
}
