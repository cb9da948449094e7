package com.ajjpj.upool.api;

import com.ajjpj.afoundation.function.AStatement1;


public interface UThreadPool {
    /**
     * Appends a task to the pool's queue and wakes up one idle worker. This method is safe to call from any number of
     *  threads concurrently.
     *
     * @throws com.ajjpj.upool.api.exc.UPoolException with kind {@code AllocationFailure} or {@code LockFailure}; the
     *  task is not queued in either case
     * @throws com.ajjpj.upool.api.exc.UPoolRejectedException if the pool is shutting down or down
     */
    void submit (UTask<?> task);

    default void submit (Runnable code) {
        submit (UTask.of (code));
    }

    default <T> void submit (AStatement1<? super T, ? extends Exception> routine, T arg) {
        submit (UTask.of (routine, arg));
    }
}
