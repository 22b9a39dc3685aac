package io.perfectsched.core.database;

import java.util.Properties;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.perfectsched.client.config.Config;
import io.perfectsched.client.config.ConfigException;
import org.junit.Test;

import static io.perfectsched.core.database.DatabaseTestingUtils.createConfig;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class DatabaseConfigTest
{
    private static Config minimal()
    {
        return createConfig()
            .set("database.url", "jdbc:h2:mem:test")
            .set("database.table", "schedules");
    }

    private static void assertConfigError(Config config, String message)
    {
        try {
            DatabaseConfig.convertFrom(config);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString(message));
        }
    }

    @Test
    public void defaults()
    {
        DatabaseConfig config = DatabaseConfig.convertFrom(minimal());

        assertThat(config.getType(), is("h2"));
        assertThat(config.getUrl(), is("jdbc:h2:mem:test"));
        assertThat(config.getTable(), is("schedules"));
        assertThat(config.getUser(), is(Optional.absent()));
        assertThat(config.getMaxRetry(), is(10));
        assertThat(config.getRetryWait(), is(500));
        assertThat(config.getAcquireBatchSize(), is(4));
        assertThat(config.getConnectionTimeout(), is(30));
        assertThat(config.getValidationTimeout(), is(5));
        assertThat(config.getAutoMigrate(), is(true));
        assertThat(config.getOptions().isEmpty(), is(true));
    }

    @Test
    public void postgresqlWithOptions()
    {
        DatabaseConfig config = DatabaseConfig.convertFrom(createConfig()
                .set("database.url", "jdbc:postgresql://db.example.com:5432/sched")
                .set("database.table", "schedules")
                .set("database.user", "sched")
                .set("database.password", "secret")
                .set("database.maxRetry", 3)
                .set("database.acquireBatchSize", 8)
                .set("database.migrate", false)
                .set("database.opts.sslmode", "require"));

        assertThat(config.getType(), is("postgresql"));
        assertThat(config.getMaxRetry(), is(3));
        assertThat(config.getAcquireBatchSize(), is(8));
        assertThat(config.getAutoMigrate(), is(false));
        assertThat(config.getOptions(), is(ImmutableMap.of("sslmode", "require")));

        Properties props = DatabaseConfig.buildJdbcProperties(config);
        assertThat(props.getProperty("user"), is("sched"));
        assertThat(props.getProperty("password"), is("secret"));
        assertThat(props.getProperty("sslmode"), is("require"));
        assertThat(props.getProperty("tcpKeepAlive"), is("true"));
    }

    @Test
    public void urlIsRequired()
    {
        assertConfigError(minimal().remove("database.url"), "database.url option is required");
    }

    @Test
    public void tableIsRequired()
    {
        assertConfigError(minimal().remove("database.table"), "database.table option is required");
    }

    @Test
    public void invalidTableName()
    {
        assertConfigError(minimal().set("database.table", "schedules; drop table x"), "Invalid database.table");
    }

    @Test
    public void unsupportedUrl()
    {
        assertConfigError(minimal().set("database.url", "jdbc:sqlite:test.db"), "Unsupported database url");
    }

    @Test
    public void nonPositiveRetry()
    {
        assertConfigError(minimal().set("database.maxRetry", 0), "database.maxRetry must be positive");
    }

    @Test
    public void negativeRetryWait()
    {
        assertConfigError(minimal().set("database.retryWait", -1), "database.retryWait must not be negative but got -1");
        assertThat(DatabaseConfig.convertFrom(minimal().set("database.retryWait", 0)).getRetryWait(), is(0));
    }
}
