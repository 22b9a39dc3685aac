package io.perfectsched.core.database;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

import io.perfectsched.client.ObjectMappers;
import io.perfectsched.client.config.Config;
import io.perfectsched.client.config.ConfigFactory;

public class DatabaseTestingUtils
{
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z");

    private DatabaseTestingUtils() { }

    public static ConfigFactory createConfigFactory()
    {
        return new ConfigFactory(ObjectMappers.objectMapper());
    }

    public static Config createConfig()
    {
        return createConfigFactory().create();
    }

    /**
     * Returns options of a new in-memory H2 database.
     */
    public static Config createDatabaseConfig()
    {
        return createConfig()
            .set("database.url", "jdbc:h2:mem:perfectsched-" + UUID.randomUUID())
            .set("database.table", "test_schedules")
            .set("database.retryWait", 10);
    }

    public static Instant instant(String time)
    {
        return Instant.from(ZonedDateTime.parse(time, TIME_FORMAT));
    }
}
