package io.perfectsched.core.schedule;

/**
 * An exception thrown when the key of a new schedule already exists.
 *
 * This exception is deterministic.
 */
public class ResourceConflictException extends Exception
{
    public ResourceConflictException(String message)
    {
        super(message);
    }

    public ResourceConflictException(Throwable cause)
    {
        super(cause);
    }

    public ResourceConflictException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
