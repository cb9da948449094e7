package com.ajjpj.upool.api;


import java.util.List;


public interface UThreadPoolWithAdmin extends UThreadPool {
    enum State { Running, ShuttingDown, Down }

    /**
     * <ul>
     *     <li>{@code ExecuteSubmitted}: workers only observe shutdown while waiting for work, so everything in the queue
     *          is executed before they stop.</li>
     *     <li>{@code SkipUnstarted}: workers stop at their next attempt to fetch a task. Tasks that were not started
     *          are discarded and returned by {@link #destroy(ShutdownMode)}.</li>
     * </ul>
     * Running tasks are never interrupted.
     */
    enum ShutdownMode { ExecuteSubmitted, SkipUnstarted }

    int getNumThreads ();

    UThreadPoolStatistics getStatistics ();

    State getState ();

    /**
     * Blocks until every task submitted since the previous drain has finished executing, and resets the counters for
     *  the next cycle. <p>
     * This method returns holding both of the queue's locks: other threads calling {@link #submit(UTask)} block until
     *  {@link #release()} is called. {@code release()} must be called immediately afterwards, from the same thread.
     */
    void awaitDrained () throws InterruptedException;

    /**
     * Releases the locks acquired by {@link #awaitDrained()}.
     */
    void release ();

    /**
     * @return the number of tasks that were submitted in the current cycle but have not finished executing yet
     */
    long pendingCount ();

    default List<UTask<?>> destroy () {
        return destroy (ShutdownMode.ExecuteSubmitted);
    }

    /**
     * Stops all worker threads and waits for them to terminate. A pool can be destroyed only once.<p>
     *
     * If joining a worker fails (the calling thread is interrupted or the configured join timeout expires), this method
     *  throws a {@code ThreadJoinFailure} and deliberately releases <em>nothing</em>: the pool stays in state
     *  {@code ShuttingDown} with its queue intact. Recovering from this is the caller's responsibility, typically by
     *  calling {@link #awaitTermination()} and then dropping all references to the pool.
     *
     * @return the tasks that were still queued and are discarded
     */
    List<UTask<?>> destroy (ShutdownMode shutdownMode);

    /**
     * Joins all worker threads without a timeout.
     */
    void awaitTermination () throws InterruptedException;
}
