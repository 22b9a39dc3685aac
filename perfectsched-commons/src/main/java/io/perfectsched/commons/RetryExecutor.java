package io.perfectsched.commons;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

public class RetryExecutor
{
    public static RetryExecutor retryExecutor()
    {
        return new RetryExecutor();
    }

    /**
     * Thrown when an operation fails with an exception that is not retryable
     * or when the retry limit is reached. {@link #getCause()} is the exception
     * thrown by the last attempt.
     */
    public static class RetryGiveupException
            extends ExecutionException
    {
        public RetryGiveupException(String message, Exception cause)
        {
            super(message, cause);
        }

        public RetryGiveupException(Exception cause)
        {
            super(cause);
        }

        @Override
        public Exception getCause()
        {
            return (Exception) super.getCause();
        }
    }

    public interface RetryPredicate
            extends Predicate<Exception>
    { }

    public interface RetryAction
    {
        void onRetry(Exception exception, int retryCount, int retryLimit, int retryWait)
            throws RetryGiveupException;
    }

    public interface GiveupAction
    {
        void onGiveup(Exception firstException, Exception lastException, int retryCount)
            throws RetryGiveupException;
    }

    private final int retryLimit;
    private final int initialRetryWait;
    private final int maxRetryWait;
    private final double waitGrowRate;
    private final RetryPredicate retryPredicate;
    private final RetryAction retryAction;
    private final GiveupAction giveupAction;

    private RetryExecutor()
    {
        this(5, 1000, 30 * 60 * 1000, 3.0, null, null, null);
    }

    private RetryExecutor(int retryLimit, int initialRetryWait, int maxRetryWait, double waitGrowRate,
            RetryPredicate retryPredicate, RetryAction retryAction, GiveupAction giveupAction)
    {
        this.retryLimit = retryLimit;
        this.initialRetryWait = initialRetryWait;
        this.maxRetryWait = maxRetryWait;
        this.waitGrowRate = waitGrowRate;
        this.retryPredicate = retryPredicate;
        this.retryAction = retryAction;
        this.giveupAction = giveupAction;
    }

    public RetryExecutor withRetryLimit(int count)
    {
        return new RetryExecutor(
                count, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, giveupAction);
    }

    /**
     * Waits the same amount of time before every retry.
     */
    public RetryExecutor withFixedRetryWait(int msec)
    {
        return new RetryExecutor(
                retryLimit, msec, msec, 1.0,
                retryPredicate, retryAction, giveupAction);
    }

    public RetryExecutor retryIf(RetryPredicate function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                function, retryAction, giveupAction);
    }

    public RetryExecutor onRetry(RetryAction function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, function, giveupAction);
    }

    public RetryExecutor onGiveup(GiveupAction function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, function);
    }

    public <T> T run(Callable<T> op)
            throws RetryGiveupException
    {
        int retryCount = 0;

        Exception firstException = null;

        while (true) {
            try {
                return op.call();
            }
            catch (Exception exception) {
                if (firstException == null) {
                    firstException = exception;
                }
                if (retryCount >= retryLimit || retryPredicate == null || !retryPredicate.test(exception)) {
                    if (giveupAction != null) {
                        giveupAction.onGiveup(firstException, exception, retryCount);
                    }
                    throw new RetryGiveupException(exception);
                }

                // exponential back-off with hard limit. waitGrowRate = 1.0 makes it fixed.
                int retryWait = (int) Math.min((double) maxRetryWait, initialRetryWait * Math.pow(waitGrowRate, retryCount));

                retryCount++;
                if (retryAction != null) {
                    retryAction.onRetry(exception, retryCount, retryLimit, retryWait);
                }

                try {
                    Thread.sleep(retryWait);
                }
                catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new RetryGiveupException("Interrupted while waiting for retry", exception);
                }
            }
        }
    }
}
