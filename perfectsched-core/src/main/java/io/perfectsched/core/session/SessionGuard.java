package io.perfectsched.core.session;

import java.util.concurrent.locks.ReentrantLock;

import com.google.inject.Inject;
import io.perfectsched.commons.RetryExecutor.RetryGiveupException;
import io.perfectsched.commons.ThrowablesUtil;
import io.perfectsched.core.database.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.perfectsched.commons.RetryExecutor.retryExecutor;

/**
 * Serializes access to the schedule store from this process and retries
 * actions that fail with a transient conflict.
 *
 * An action runs with a fresh {@link Session} for each attempt. The session is
 * closed whether the attempt succeeds or fails. When the action keeps failing
 * with transient conflicts, the exception thrown by the last attempt is
 * rethrown as is. Other exceptions are rethrown immediately without retrying.
 */
public class SessionGuard
{
    private static final Logger logger = LoggerFactory.getLogger(SessionGuard.class);

    private final SessionFactory sessionFactory;
    private final int maxRetry;
    private final int retryWait;
    private final ReentrantLock lock = new ReentrantLock(true);

    @Inject
    public SessionGuard(SessionFactory sessionFactory, DatabaseConfig config)
    {
        this(sessionFactory, config.getMaxRetry(), config.getRetryWait());
    }

    /**
     * @param maxRetry total number of attempts
     * @param retryWait wait before each retry in milliseconds
     */
    public SessionGuard(SessionFactory sessionFactory, int maxRetry, int retryWait)
    {
        if (maxRetry < 1) {
            throw new IllegalArgumentException("maxRetry must be positive: " + maxRetry);
        }
        this.sessionFactory = sessionFactory;
        this.maxRetry = maxRetry;
        this.retryWait = retryWait;
    }

    public <T> T withSession(
            SessionAction<T, RuntimeException, RuntimeException, RuntimeException> action)
    {
        try {
            return runWithRetry(action);
        }
        catch (Exception ex) {
            throw ThrowablesUtil.propagate(ex);
        }
    }

    public <T, E1 extends Exception> T withSession(
            SessionAction<T, E1, RuntimeException, RuntimeException> action, Class<E1> e1)
        throws E1
    {
        try {
            return runWithRetry(action);
        }
        catch (Exception ex) {
            ThrowablesUtil.propagateIfInstanceOf(ex, e1);
            throw ThrowablesUtil.propagate(ex);
        }
    }

    public <T, E1 extends Exception, E2 extends Exception> T withSession(
            SessionAction<T, E1, E2, RuntimeException> action, Class<E1> e1, Class<E2> e2)
        throws E1, E2
    {
        try {
            return runWithRetry(action);
        }
        catch (Exception ex) {
            ThrowablesUtil.propagateIfInstanceOf(ex, e1);
            ThrowablesUtil.propagateIfInstanceOf(ex, e2);
            throw ThrowablesUtil.propagate(ex);
        }
    }

    public <T, E1 extends Exception, E2 extends Exception, E3 extends Exception> T withSession(
            SessionAction<T, E1, E2, E3> action, Class<E1> e1, Class<E2> e2, Class<E3> e3)
        throws E1, E2, E3
    {
        try {
            return runWithRetry(action);
        }
        catch (Exception ex) {
            ThrowablesUtil.propagateIfInstanceOf(ex, e1);
            ThrowablesUtil.propagateIfInstanceOf(ex, e2);
            ThrowablesUtil.propagateIfInstanceOf(ex, e3);
            throw ThrowablesUtil.propagate(ex);
        }
    }

    private <T, E1 extends Exception, E2 extends Exception, E3 extends Exception> T runWithRetry(
            SessionAction<T, E1, E2, E3> action)
        throws Exception
    {
        lock.lock();
        try {
            return retryExecutor()
                .withRetryLimit(maxRetry - 1)
                .withFixedRetryWait(retryWait)
                .retryIf(sessionFactory::isTransientConflict)
                .onRetry((exception, retryCount, retryLimit, wait) ->
                        logger.warn("Transient conflict on the schedule store; retrying {}/{} in {}ms: {}",
                            retryCount, retryLimit, wait, exception.toString()))
                .onGiveup((firstException, lastException, retryCount) -> {
                    if (sessionFactory.isTransientConflict(lastException)) {
                        logger.error("Giving up after {} attempts because of transient conflicts", retryCount + 1, lastException);
                    }
                })
                .run(() -> {
                    try (Session session = sessionFactory.openSession()) {
                        return action.run(session);
                    }
                });
        }
        catch (RetryGiveupException ex) {
            throw ex.getCause();
        }
        finally {
            lock.unlock();
        }
    }
}
