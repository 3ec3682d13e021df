package com.icodici.names.registry;

import com.icodici.names.Errors;
import com.icodici.names.exception.NameServiceError;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive lock for state-changing operations of one component. Calls from other threads wait their turn; a call
 * made on a thread that already holds the guard, for example from a payment receiver reacting to a transfer, fails
 * at once with {@link Errors#REENTRANCY_BLOCKED}. The guard is released on every exit path.
 */
public final class ReentrancyGuard {

    /**
     * Guarded work.
     */
    @FunctionalInterface
    public interface Action<T> {
        T run() throws NameServiceError;
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final String owner;

    /**
     * @param owner name of the protected component, used in error messages
     */
    public ReentrancyGuard(String owner) {
        this.owner = owner;
    }

    /**
     * Execute the action exclusively.
     *
     * @param operation name of the operation, for the error record
     * @param action    to execute
     *
     * @return whatever the action returns
     *
     * @throws NameServiceError whatever the action throws, or {@link Errors#REENTRANCY_BLOCKED}
     */
    public <T> T synchronize(String operation, Action<T> action) throws NameServiceError {
        if (lock.isHeldByCurrentThread())
            throw new NameServiceError(Errors.REENTRANCY_BLOCKED, operation,
                                       "reentrant call into " + owner + " is not allowed");
        lock.lock();
        try {
            return action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
