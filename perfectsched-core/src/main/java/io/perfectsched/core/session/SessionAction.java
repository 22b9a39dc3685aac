package io.perfectsched.core.session;

@FunctionalInterface
public interface SessionAction<T, E1 extends Exception, E2 extends Exception, E3 extends Exception>
{
    T run(Session session)
            throws E1, E2, E3;
}
