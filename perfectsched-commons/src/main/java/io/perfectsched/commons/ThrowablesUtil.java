package io.perfectsched.commons;

import com.google.common.base.Optional;
import com.google.common.base.Throwables;

public class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows the throwable as is if it's unchecked. Otherwise wraps it in a RuntimeException.
     * Callers write {@code throw ThrowablesUtil.propagate(ex)} so that the compiler knows
     * the statement never completes normally.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    public static <X extends Throwable> void propagateIfInstanceOf(Throwable throwable, Class<X> declaredType)
            throws X
    {
        if (throwable != null) {
            Throwables.throwIfInstanceOf(throwable, declaredType);
        }
    }

    /**
     * Walks the cause chain of the throwable (including itself) and returns the first
     * instance of the given type.
     */
    public static <X extends Throwable> Optional<X> findCause(Throwable throwable, Class<X> type)
    {
        for (Throwable t : Throwables.getCausalChain(throwable)) {
            if (type.isInstance(t)) {
                return Optional.of(type.cast(t));
            }
        }
        return Optional.absent();
    }
}
