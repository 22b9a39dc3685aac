package io.perfectsched.core.schedule;

/**
 * An exception thrown when a heartbeat or finish uses a token whose occurrence
 * is already finished, typically because another worker claimed the schedule
 * after the lease of the token expired.
 *
 * This exception is deterministic.
 */
public class AlreadyFinishedException extends Exception
{
    public AlreadyFinishedException(String message)
    {
        super(message);
    }
}
