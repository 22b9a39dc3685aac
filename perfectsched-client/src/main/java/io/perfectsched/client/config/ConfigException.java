package io.perfectsched.client.config;

/**
 * An exception thrown when a required configuration is missing or has an invalid value.
 *
 * This exception is deterministic. Retrying the same operation doesn't help.
 */
public class ConfigException
        extends RuntimeException
{
    public ConfigException(String message)
    {
        super(message);
    }

    public ConfigException(Throwable cause)
    {
        super(cause);
    }

    public ConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
