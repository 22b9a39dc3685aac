package io.perfectsched.core.database;

import java.util.Map;
import java.util.Properties;
import java.util.regex.Pattern;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.perfectsched.client.config.Config;
import io.perfectsched.client.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
public interface DatabaseConfig
{
    Pattern TABLE_NAME_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    String getUrl();

    String getTable();

    Optional<String> getUser();

    Optional<String> getPassword();

    Map<String, String> getOptions();

    // total number of attempts when a statement fails because of a transient conflict
    int getMaxRetry();

    int getRetryWait();  // milliseconds

    int getAcquireBatchSize();

    boolean getAutoMigrate();

    ////
    // HikariCP config params
    //

    int getConnectionTimeout();  // seconds

    int getValidationTimeout();  // seconds

    default String getType()
    {
        return typeOf(getUrl());
    }

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        return convertFrom(config, "database");
    }

    static DatabaseConfig convertFrom(Config config, String keyPrefix)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        String url = config.getOptional(keyPrefix + "." + "url", String.class).orNull();
        if (url == null) {
            throw new ConfigException(keyPrefix + ".url option is required");
        }
        typeOf(url);  // validates
        builder.url(url);

        String table = config.getOptional(keyPrefix + "." + "table", String.class).orNull();
        if (table == null) {
            throw new ConfigException(keyPrefix + ".table option is required");
        }
        if (!TABLE_NAME_PATTERN.matcher(table).matches()) {
            throw new ConfigException("Invalid " + keyPrefix + ".table: " + table);
        }
        builder.table(table);

        builder.user(config.getOptional(keyPrefix + "." + "user", String.class));
        builder.password(config.getOptional(keyPrefix + "." + "password", String.class));

        builder.maxRetry(
                positive(keyPrefix + ".maxRetry", config.get(keyPrefix + "." + "maxRetry", int.class, 10)));
        builder.retryWait(
                nonNegative(keyPrefix + ".retryWait", config.get(keyPrefix + "." + "retryWait", int.class, 500)));
        builder.acquireBatchSize(
                positive(keyPrefix + ".acquireBatchSize", config.get(keyPrefix + "." + "acquireBatchSize", int.class, 4)));

        builder.connectionTimeout(
                config.get(keyPrefix + "." + "connectionTimeout", int.class, 30));  // HikariCP default: 30
        builder.validationTimeout(
                config.get(keyPrefix + "." + "validationTimeout", int.class, 5));  // HikariCP default: 5

        // database.opts.* to options
        ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        for (String key : config.getKeys()) {
            String optionKey = keyPrefix + "." + "opts.";
            if (key.startsWith(optionKey)) {
                options.put(key.substring(optionKey.length()), config.get(key, String.class));
            }
        }
        builder.options(options.build());

        builder.autoMigrate(
                config.get(keyPrefix + "." + "migrate", boolean.class, true));

        return builder.build();
    }

    static String typeOf(String url)
    {
        if (url.startsWith("jdbc:h2:")) {
            return "h2";
        }
        else if (url.startsWith("jdbc:postgresql:")) {
            return "postgresql";
        }
        throw new ConfigException("Unsupported database url: " + url);
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();

        // add default params
        switch (config.getType()) {
        case "h2":
            // nothing
            break;

        case "postgresql":
            props.setProperty("tcpKeepAlive", "true");
            break;

        default:
            throw new ConfigException("Unsupported database type: "+config.getType());
        }

        if (config.getUser().isPresent()) {
            props.setProperty("user", config.getUser().get());
        }
        if (config.getPassword().isPresent()) {
            props.setProperty("password", config.getPassword().get());
        }

        for (Map.Entry<String, String> pair : config.getOptions().entrySet()) {
            props.setProperty(pair.getKey(), pair.getValue());
        }

        return props;
    }

    private static int nonNegative(String key, int value)
    {
        if (value < 0) {
            throw new ConfigException(key + " must not be negative but got " + value);
        }
        return value;
    }

    private static int positive(String key, int value)
    {
        if (value <= 0) {
            throw new ConfigException(key + " must be positive but got " + value);
        }
        return value;
    }
}
