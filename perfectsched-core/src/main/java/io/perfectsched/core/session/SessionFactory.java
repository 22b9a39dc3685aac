package io.perfectsched.core.session;

public interface SessionFactory
{
    Session openSession();

    /**
     * Returns true if the exception is a conflict with another transaction
     * (deadlock or serialization failure) that is expected to succeed when
     * the whole action runs again.
     */
    boolean isTransientConflict(Exception exception);
}
